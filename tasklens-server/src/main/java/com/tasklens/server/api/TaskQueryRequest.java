package com.tasklens.server.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskQueryRequest {
    private String query;
    private String teamRoot;   // defaults to tasklens.query.team-root
    private List<String> teams;
    private List<String> engineers;
    private Integer limit;     // clamped to [1, 200], default 20
}
