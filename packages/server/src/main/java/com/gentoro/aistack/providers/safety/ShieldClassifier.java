package com.gentoro.aistack.providers.safety;

import com.gentoro.aistack.apis.inference.Message;
import java.util.List;
import java.util.Map;

/** Backend of a shield. An empty result means the conversation is safe. */
public interface ShieldClassifier {

  List<ShieldFinding> classify(List<Message> messages, Map<String, Object> params);
}
