package im.arun.treebinder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Nested, serialisable snapshot of a bound tree, used for JSON output.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TreeOutline {

    @JsonProperty("label")
    private String label;

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("path")
    private String path;

    @JsonProperty("marked")
    private Boolean marked;

    @JsonProperty("nodes")
    private List<TreeOutline> nodes;
}
