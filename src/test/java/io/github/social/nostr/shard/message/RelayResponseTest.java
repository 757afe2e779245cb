package io.github.social.nostr.shard.message;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

class RelayResponseTest {

    @Test
    void writesFramesAsJsonArrays() {
        assertEquals("[\"OK\",\"abc\",true,\"\"]", RelayResponse.ok("abc", true, ""));
        assertEquals("[\"CLOSED\",\"s\",\"error: x\"]", RelayResponse.closed("s", "error: x"));
        assertEquals("[\"EOSE\",\"s\"]", RelayResponse.eose("s"));
    }

    @Test
    void keepsHtmlCharactersVerbatim() {
        final JsonObject event = new JsonObject();
        event.addProperty("content", "<b>&'</b>");

        assertEquals("[\"EVENT\",\"s\",{\"content\":\"<b>&'</b>\"}]", RelayResponse.event("s", event));
    }

}
