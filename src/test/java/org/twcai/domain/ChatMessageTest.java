package org.twcai.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.twcai.domain.content.ContentItem;
import org.twcai.utils.JsonUtils;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatMessageTest {

    private final ObjectMapper objectMapper = JsonUtils.createObjectMapper();

    @Test
    void factoriesSetRoleAndTextContent() {
        assertThat(ChatMessage.user("Hello, world!").getRole()).isEqualTo(Role.USER);
        assertThat(ChatMessage.system("You are a helpful assistant.").getRole()).isEqualTo(Role.SYSTEM);
        assertThat(ChatMessage.assistant("How can I help?").getRole()).isEqualTo(Role.ASSISTANT);
        assertThat(ChatMessage.developer("Be terse.").getRole()).isEqualTo(Role.DEVELOPER);
        assertThat(ChatMessage.user("Hello, world!").getContent().asText()).isEqualTo("Hello, world!");
    }

    @Test
    void multimodalMessageUsesParts() {
        ChatMessage message = ChatMessage.userMultimodal(List.of(
                ContentItem.text("What's in this image?"),
                ContentItem.imageUrl("https://example.com/image.jpg")));

        assertThat(message.getRole()).isEqualTo(Role.USER);
        assertThat(message.getContent().isText()).isFalse();
        assertThat(message.getContent().asParts()).hasSize(2);
    }

    @Test
    void partCountIsNotLimitedClientSide() throws Exception {
        List<ContentItem> items = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            items.add(ContentItem.text("part " + i));
        }

        ChatMessage message = ChatMessage.userMultimodal(items);
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(message));

        assertThat(json.path("content")).hasSize(25);
        assertThat(json.path("content").get(24).path("text").asText()).isEqualTo("part 24");
    }

    @Test
    void rolesSerializeLowercase() throws Exception {
        assertThat(objectMapper.writeValueAsString(Role.USER)).isEqualTo("\"user\"");
        assertThat(objectMapper.writeValueAsString(Role.ASSISTANT)).isEqualTo("\"assistant\"");
        assertThat(objectMapper.writeValueAsString(Role.SYSTEM)).isEqualTo("\"system\"");
        assertThat(objectMapper.writeValueAsString(Role.TOOL)).isEqualTo("\"tool\"");
    }

    @Test
    void finishReasonUsesSnakeCase() throws Exception {
        assertThat(objectMapper.writeValueAsString(FinishReason.STOP)).isEqualTo("\"stop\"");
        assertThat(objectMapper.readValue("\"content_filter\"", FinishReason.class))
                .isEqualTo(FinishReason.CONTENT_FILTER);
        assertThat(objectMapper.readValue("\"something_new\"", FinishReason.class)).isNull();
    }

    @Test
    void unsetOptionalFieldsAreOmitted() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(ChatMessage.user("hi")));

        assertThat(json.has("name")).isFalse();
        assertThat(json.has("tool_call_id")).isFalse();
        assertThat(json.has("tool_calls")).isFalse();
    }
}
