package org.hypertrace.logalert.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads alert rules from a JSON file holding an array of rule documents. */
public class FSRuleSource implements RuleSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(FSRuleSource.class);
  static final String PATH_CONFIG = "path";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final Config fsConfig;
  private final AlertRuleReader alertRuleReader;

  public FSRuleSource(Config fsConfig) {
    this.fsConfig = fsConfig;
    this.alertRuleReader = new AlertRuleReader();
  }

  @Override
  public List<AlertRule> getAllRules(Predicate<JsonNode> predicate) throws IOException {
    List<AlertRule> rules = new ArrayList<>();
    for (JsonNode ruleNode : getJsonNodes(fsConfig.getString(PATH_CONFIG))) {
      if (predicate.test(ruleNode)) {
        rules.add(alertRuleReader.read(ruleNode));
      }
    }
    LOGGER.info("Read {} alert rules from {}", rules.size(), fsConfig.getString(PATH_CONFIG));
    return rules;
  }

  private List<JsonNode> getJsonNodes(String fsPath) throws IOException {
    LOGGER.debug("Reading rules from file path:{}", fsPath);
    JsonNode jsonNode = OBJECT_MAPPER.readTree(new File(fsPath).getAbsoluteFile());
    if (!jsonNode.isArray()) {
      throw new IOException("File should contain an array of alert rules");
    }

    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Reading document  {}", jsonNode.toPrettyString());
    }
    return StreamSupport.stream(jsonNode.spliterator(), false)
        .collect(Collectors.toUnmodifiableList());
  }
}
