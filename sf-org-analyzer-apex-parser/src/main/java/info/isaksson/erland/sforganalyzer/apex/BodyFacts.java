package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.model.CallSite;
import info.isaksson.erland.sforganalyzer.model.DmlOperation;
import info.isaksson.erland.sforganalyzer.model.SoqlQuery;

import java.util.ArrayList;
import java.util.List;

/** Facts recovered from one method or trigger body, each list in source order. */
final class BodyFacts {
    final List<DmlOperation> dml = new ArrayList<>();
    final List<SoqlQuery> soql = new ArrayList<>();
    final List<CallSite> calls = new ArrayList<>();
}
