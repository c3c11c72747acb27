package com.tasklens.server.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Same query as {@link TaskQueryRequest}, phrased the way {@code claude -p "..."} is invoked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaudePromptRequest {
    private String p;
    private String teamRoot;
    private List<String> teams;
    private List<String> engineers;
    private Integer limit;

    public TaskQueryRequest toQueryRequest() {
        return TaskQueryRequest.builder()
                .query(p)
                .teamRoot(teamRoot)
                .teams(teams)
                .engineers(engineers)
                .limit(limit)
                .build();
    }

    public String toCommand() {
        return "claude -p \"%s\"".formatted(p);
    }
}
