package com.gentoro.aistack.apis.models;

/** Routing table of the models served by the configured inference providers. */
public interface Models {
  String LIST = "list";
  String GET = "get";

  ListModelsResponse listModels();

  Model getModel(ModelRef ref);
}
