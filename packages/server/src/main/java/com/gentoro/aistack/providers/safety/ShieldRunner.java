package com.gentoro.aistack.providers.safety;

import com.gentoro.aistack.apis.safety.RunShieldRequest;
import com.gentoro.aistack.apis.safety.RunShieldResponse;
import com.gentoro.aistack.apis.safety.Safety;
import com.gentoro.aistack.apis.safety.ViolationLevel;
import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inline safety provider. Runs the classifier registered for a shield id and folds its findings
 * into a single verdict: the highest level wins and the message and metadata of that finding are
 * returned as reported by the classifier.
 */
public class ShieldRunner implements Safety {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(ShieldRunner.class);

  private final Map<String, ShieldClassifier> shields;

  public ShieldRunner(Map<String, ShieldClassifier> shields) {
    this.shields = Collections.unmodifiableMap(new LinkedHashMap<>(shields));
  }

  public Set<String> shieldIds() {
    return shields.keySet();
  }

  @Override
  public RunShieldResponse runShield(RunShieldRequest request) {
    if (request == null || request.shieldType() == null || request.shieldType().isBlank()) {
      throw new ValidationException("shield_type is required");
    }
    ShieldClassifier classifier = shields.get(request.shieldType());
    if (classifier == null) {
      throw new RoutingException(
          StackErrorCode.UNKNOWN_SHIELD,
          "Unknown shield: " + request.shieldType(),
          Map.of("shield_type", request.shieldType(), "known_shields", List.copyOf(shieldIds())));
    }
    if (request.messages() == null || request.messages().isEmpty()) {
      throw new ValidationException("run_shield requires at least one message");
    }

    List<ShieldFinding> findings =
        classifier.classify(
            request.messages(), request.params() == null ? Map.of() : request.params());

    ShieldFinding top = null;
    for (ShieldFinding finding : findings) {
      if (finding == null || finding.level() == null) continue;
      if (top == null || finding.level().compareTo(top.level()) > 0) {
        top = finding;
      }
    }
    if (top == null || top.level() == ViolationLevel.NONE) {
      log.debug("Shield {} found no violation", request.shieldType());
      return RunShieldResponse.none();
    }
    log.info("Shield {} reported a {} violation", request.shieldType(), top.level());
    return new RunShieldResponse(
        top.level(), top.userMessage(), top.metadata() == null ? Map.of() : top.metadata());
  }
}
