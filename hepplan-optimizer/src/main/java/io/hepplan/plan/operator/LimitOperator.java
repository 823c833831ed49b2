package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Skips {@code offset} rows and then returns at most {@code limit} rows. A null bound means no bound.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LimitOperator extends Operator {
    @JsonProperty("offset")
    public final Long offset;
    @JsonProperty("limit")
    public final Long limit;

    @JsonCreator
    public LimitOperator(@JsonProperty("offset") @Nullable Long offset,
                         @JsonProperty("limit") @Nullable Long limit) {
        Preconditions.checkArgument(offset == null || offset >= 0, "Negative offset: %s", offset);
        Preconditions.checkArgument(limit == null || limit >= 0, "Negative limit: %s", limit);
        this.offset = offset;
        this.limit = limit;
    }

    public static LimitOperator of(long limit) {
        return new LimitOperator(null, limit);
    }

    public long offsetOrZero() {
        return offset == null ? 0 : offset;
    }

    /**
     * The number of rows the input must produce at most to satisfy this limit, or null if unbounded.
     */
    public Long fetch() {
        return limit == null ? null : offsetOrZero() + limit;
    }

    @Override
    public OperatorType type() {return OperatorType.LIMIT;}

    @Override
    protected List<Object> args() {
        return Arrays.asList(
                offset == null ? null : "offset=" + offset,
                limit == null ? null : "limit=" + limit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LimitOperator that = (LimitOperator) o;
        return Objects.equals(offset, that.offset) && Objects.equals(limit, that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, limit);
    }
}
