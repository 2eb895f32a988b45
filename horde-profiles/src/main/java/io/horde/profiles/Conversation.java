package io.horde.profiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chat transcript kept in a virtual user's session, one role/content map per message.
 */
final class Conversation {

    private final List<Map<String, String>> messages = new ArrayList<>();

    List<Map<String, String>> messages() {
        return messages;
    }
}
