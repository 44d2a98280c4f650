package tech.noetzold.guardrail_api.model;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {
    @NotNull
    private String role;
    @NotNull
    private String content;
}
