package im.arun.treebinder.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Leaf value. Rendered through the binder's {@code ScalarFormatter}.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ScalarNode extends DataNode {

    private final Object value;

    public ScalarNode(Object value) {
        this.value = value;
    }

    @Override
    public DataKind kind() {
        return DataKind.SCALAR;
    }
}
