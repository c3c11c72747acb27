package com.tasklens.server.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tasklens.server.core.model.ScoredMatch;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"command", "teamRoot", "query", "scannedTeams", "scannedEngineers",
        "scannedFiles", "extractedTasks", "matches"})
public class TaskQueryResult {
    String command;   // only set by the claude -p variant
    String teamRoot;
    String query;
    List<String> scannedTeams;
    List<String> scannedEngineers;
    int scannedFiles;
    int extractedTasks;
    List<ScoredMatch> matches;

    public static TaskQueryResult empty(String teamRoot, String query) {
        return TaskQueryResult.builder()
                .teamRoot(teamRoot)
                .query(query)
                .scannedTeams(List.of())
                .scannedEngineers(List.of())
                .scannedFiles(0)
                .extractedTasks(0)
                .matches(List.of())
                .build();
    }
}
