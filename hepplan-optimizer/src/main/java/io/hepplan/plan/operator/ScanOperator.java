package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanOperator extends Operator {
    @JsonProperty("table")
    public final String table;
    @JsonProperty("columns")
    public final List<String> columns;
    @JsonProperty("offset")
    public final Long offset;
    @JsonProperty("limit")
    public final Long limit;

    @JsonCreator
    public ScanOperator(@JsonProperty("table") String table,
                        @JsonProperty("columns") List<String> columns,
                        @JsonProperty("offset") @Nullable Long offset,
                        @JsonProperty("limit") @Nullable Long limit) {
        Preconditions.checkArgument(table != null && !table.isEmpty(), "Scan must have a table");
        this.table = table;
        this.columns = columns == null ? ImmutableList.of() : ImmutableList.copyOf(columns);
        this.offset = offset;
        this.limit = limit;
    }

    public ScanOperator(String table, List<String> columns) {
        this(table, columns, null, null);
    }

    public boolean bounded() {
        return limit != null;
    }

    public ScanOperator withColumns(List<String> columns) {
        return new ScanOperator(table, columns, offset, limit);
    }

    public ScanOperator withBounds(@Nullable Long offset, @Nullable Long limit) {
        return new ScanOperator(table, columns, offset, limit);
    }

    @Override
    public OperatorType type() {return OperatorType.SCAN;}

    @Override
    protected List<Object> args() {
        return Arrays.asList(
                table,
                columns,
                offset == null ? null : "offset=" + offset,
                limit == null ? null : "limit=" + limit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScanOperator that = (ScanOperator) o;
        return table.equals(that.table)
                && columns.equals(that.columns)
                && Objects.equals(offset, that.offset)
                && Objects.equals(limit, that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, columns, offset, limit);
    }
}
