package info.isaksson.erland.sforganalyzer.doc;

/**
 * Turns a snapshot into prose. Implementations backed by a language model live outside this project; they
 * receive the snapshot by value and may run out of process.
 */
public interface DocumentationGenerator {

    GeneratedDocumentation generate(DocumentationSnapshot snapshot);
}
