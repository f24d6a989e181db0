package io.assessmodel.core.node;

import io.assessmodel.core.result.BranchNodeResult;
import io.assessmodel.core.result.Result;
import java.time.Instant;

/// A nested group of nodes inside an assessment or another section.
public final class Section extends BranchNode {

    private Section(Builder builder) {
        super(NodeType.SECTION, builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Result instantiateResult(Instant startDate) {
        return new BranchNodeResult(id, startDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Section other)) return false;
        return baseEquals(other);
    }

    @Override
    public int hashCode() {
        return baseHashCode();
    }

    public static final class Builder extends BranchNode.Builder<Builder> {
        private Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        public Section build() {
            return new Section(this);
        }
    }
}
