package com.gentoro.aistack.providers.safety;

import com.gentoro.aistack.apis.safety.ViolationLevel;
import java.util.Map;

/** One classifier observation. */
public record ShieldFinding(
    ViolationLevel level, String userMessage, Map<String, Object> metadata) {}
