package com.company.metrics.domain;

import com.company.metrics.domain.enums.SelectionState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of the column tree. Ids ending with {@code /} are categories, any other id is a leaf
 * ({@code /metadata/time_end_utc}) or a leaf subfield ({@code /metadata/time_end_utc/max_value}).
 */
@Getter
@Setter
@ToString(exclude = "children")
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ColumnNode {

    private final String columnNodeId;
    private final String name;
    private SelectionState selectionState = SelectionState.NONE;
    private final List<ColumnNode> children = new ArrayList<>();
    private String description;

    public ColumnNode(String columnNodeId, String name) {
        this(columnNodeId, name, null);
    }

    public ColumnNode(String columnNodeId, String name, String description) {
        this.columnNodeId = columnNodeId;
        this.name = name;
        this.description = description;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return !columnNodeId.endsWith("/");
    }

    /**
     * Recomputes the state from the children. A leaf already {@code ALL} stays {@code ALL},
     * otherwise a leaf's own state counts alongside its subfields.
     */
    void updateSelectionState() {
        if (children.isEmpty()) {
            return;
        }
        if (isLeaf() && selectionState == SelectionState.ALL) {
            return;
        }
        boolean all = !isLeaf() || selectionState == SelectionState.ALL;
        boolean none = !isLeaf() || selectionState == SelectionState.NONE;
        for (ColumnNode child : children) {
            all &= child.selectionState == SelectionState.ALL;
            none &= child.selectionState == SelectionState.NONE;
        }
        if (all) {
            selectionState = SelectionState.ALL;
        } else if (none) {
            selectionState = SelectionState.NONE;
        } else {
            selectionState = SelectionState.PARTIAL;
        }
    }
}
