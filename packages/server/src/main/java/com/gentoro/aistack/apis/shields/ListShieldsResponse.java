package com.gentoro.aistack.apis.shields;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ListShieldsResponse(@JsonProperty("shields") List<ShieldDef> shields) {}
