package tech.noetzold.guardrail_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatResponse {
    private Reply response;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Reply {
        private boolean blocked;
        private String intent;
        private String reason;      // only on deny
        private String answer;      // only on allow
    }

    public static ChatResponse blocked(String intent, String reason) {
        return new ChatResponse(Reply.builder().blocked(true).intent(intent).reason(reason).build());
    }

    public static ChatResponse answered(String intent, String answer) {
        return new ChatResponse(Reply.builder().blocked(false).intent(intent).answer(answer).build());
    }
}
