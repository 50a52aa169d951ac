package com.gentoro.aistack.apis.shields;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ShieldRef(@JsonProperty("identifier") String identifier) {}
