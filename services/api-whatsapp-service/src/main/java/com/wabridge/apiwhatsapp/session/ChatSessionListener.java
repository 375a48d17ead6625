package com.wabridge.apiwhatsapp.session;

import com.wabridge.apiwhatsapp.model.ChatEvent;
import com.wabridge.apiwhatsapp.model.ConnectionUpdate;
import java.util.List;

/** Callbacks from the chat session, delivered one at a time on the session's thread. */
public interface ChatSessionListener {

  void onConnectionUpdate(ConnectionUpdate update);

  /** New live messages, received ones and ones typed on the paired phone alike. */
  void onMessages(List<ChatEvent> events);
}
