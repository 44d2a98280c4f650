package tech.noetzold.guardrail_api.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatRequest {
    @NotEmpty
    @Valid
    private List<@NotNull ChatMessage> messages;

    public String lastContent() {
        ChatMessage last = messages.get(messages.size() - 1);
        return last.getContent() != null ? last.getContent().trim() : "";
    }
}
