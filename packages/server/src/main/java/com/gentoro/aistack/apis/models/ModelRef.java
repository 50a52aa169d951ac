package com.gentoro.aistack.apis.models;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ModelRef(@JsonProperty("identifier") String identifier) {}
