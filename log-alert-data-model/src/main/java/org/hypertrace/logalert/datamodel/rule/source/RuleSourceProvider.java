package org.hypertrace.logalert.datamodel.rule.source;

import com.typesafe.config.Config;

public class RuleSourceProvider {
  static final String RULE_SOURCE_TYPE = "type";
  static final String RULE_SOURCE_TYPE_FS = "fs";

  public static RuleSource getProvider(Config ruleSourceConfig) {
    String ruleSourceType = ruleSourceConfig.getString(RULE_SOURCE_TYPE);
    switch (ruleSourceType) {
      case RULE_SOURCE_TYPE_FS:
        return new FSRuleSource(ruleSourceConfig.getConfig(RULE_SOURCE_TYPE_FS));
      default:
        throw new IllegalArgumentException(
            String.format("Invalid rule source type:%s", ruleSourceType));
    }
  }
}
