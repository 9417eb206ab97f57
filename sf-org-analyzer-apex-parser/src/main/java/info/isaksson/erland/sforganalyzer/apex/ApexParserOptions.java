package info.isaksson.erland.sforganalyzer.apex;

/**
 * Parser gates. Each flag turns one extraction on or off; syntax is still consumed when a gate is off.
 */
public final class ApexParserOptions {
    public boolean includeInnerClasses = true;
    public boolean parseAnnotations = true;
    public boolean trackDml = true;
    public boolean trackSoql = true;
    public boolean parseDocComments = true;

    public static ApexParserOptions defaults() {
        return new ApexParserOptions();
    }
}
