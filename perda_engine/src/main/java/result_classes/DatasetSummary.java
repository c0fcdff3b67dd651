package result_classes;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import util.Timescale;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JSON-friendly overview of a parsed log: time range, point count and the
 * variables it contains.
 */
@JsonPropertyOrder({"startTime", "endTime", "durationSeconds", "variableCount", "totalPoints", "parseErrors", "variables"})
public final class DatasetSummary {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @JsonProperty("startTime")
    public final long startTime;

    @JsonProperty("endTime")
    public final long endTime;

    @JsonProperty("durationSeconds")
    public final double durationSeconds;

    @JsonProperty("variableCount")
    public final int variableCount;

    @JsonProperty("totalPoints")
    public final long totalPoints;

    @JsonProperty("parseErrors")
    public final int parseErrors;

    @JsonProperty("variables")
    public final List<Variable> variables;

    private DatasetSummary(long startTime, long endTime, int variableCount, long totalPoints,
                           int parseErrors, List<Variable> variables) {
        this.startTime = startTime;
        this.endTime = endTime;
        this.durationSeconds = Timescale.SECONDS.fromMillis(endTime - startTime);
        this.variableCount = variableCount;
        this.totalPoints = totalPoints;
        this.parseErrors = parseErrors;
        this.variables = Collections.unmodifiableList(variables);
    }

    public static DatasetSummary of(SeriesStore store) {
        List<Variable> variables = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : store.getNames().entrySet()) {
            int id = entry.getKey();
            int points = store.contains(id) ? store.get(id).size() : 0;
            variables.add(new Variable(id, entry.getValue(), points));
        }
        return new DatasetSummary(store.getStartTime(), store.getEndTime(), store.size(),
                store.getTotalPoints(), store.getReport().errorCount, variables);
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }

    @JsonPropertyOrder({"id", "name", "points"})
    public static final class Variable {
        @JsonProperty("id")
        public final int id;

        @JsonProperty("name")
        public final String name;

        @JsonProperty("points")
        public final int points;

        public Variable(int id, String name, int points) {
            this.id = id;
            this.name = name;
            this.points = points;
        }
    }
}
