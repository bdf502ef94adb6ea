package org.hypertrace.logalert.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.List;
import java.util.function.Predicate;
import org.hypertrace.logalert.datamodel.AlertRule;

public interface RuleSource {
  List<AlertRule> getAllRules(Predicate<JsonNode> predicate) throws IOException;
}
