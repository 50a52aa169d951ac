package com.gentoro.aistack.apis.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ListModelsResponse(@JsonProperty("models") List<Model> models) {}
