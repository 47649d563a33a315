package com.company.metrics.domain;

import com.company.metrics.domain.enums.SelectionState;
import com.company.metrics.dto.response.TableColumn;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hierarchy of every field observed in a batch of entries, with a selection state per node.
 * Nodes are addressed by their path id; selection changes run a top-down walk over the
 * addressed nodes followed by a bottom-up recomputation of the whole tree.
 */
@Slf4j
public class ColumnTree {

    public static final String ROOT_ID = "/";
    public static final String METADATA_PREFIX = "/metadata/";
    public static final String METRICS_PREFIX = "/metrics/";

    @Getter
    private final ColumnNode root;
    private final Map<String, ColumnNode> nodes = new HashMap<>();

    private ColumnTree(ColumnNode root) {
        this.root = root;
        index(root);
    }

    public static ColumnTree build(List<Entry> entries) {
        Map<String, ColumnNode> leaves = new LinkedHashMap<>();
        Map<String, TreeMap<String, ColumnNode>> subfields = new HashMap<>();
        for (Entry entry : entries) {
            entry.getMetadata().forEach((fieldName, value) -> {
                if (!Entry.FILES_FIELD.equals(fieldName)) {
                    addLeaf(leaves, subfields, METADATA_PREFIX + fieldName, value);
                }
            });
            entry.getMetrics().forEach((fieldName, value) -> addLeaf(leaves, subfields, METRICS_PREFIX + fieldName, value));
        }
        subfields.forEach((leafId, children) -> leaves.get(leafId).getChildren().addAll(children.values()));

        List<ColumnNode> sorted = new ArrayList<>(leaves.values());
        sorted.sort((a, b) -> a.getColumnNodeId().compareTo(b.getColumnNodeId()));

        ColumnNode root = new ColumnNode(ROOT_ID, ROOT_ID);
        attach(root, sorted, new int[]{0});
        return new ColumnTree(root);
    }

    private static void addLeaf(Map<String, ColumnNode> leaves, Map<String, TreeMap<String, ColumnNode>> subfields,
                                String leafId, FieldValue value) {
        ColumnNode leaf = leaves.get(leafId);
        if (leaf == null) {
            String description = value instanceof AnnotatedFieldValue annotated ? annotated.getDescription() : null;
            leaf = new ColumnNode(leafId, leafId.substring(leafId.lastIndexOf('/') + 1), description);
            leaves.put(leafId, leaf);
            subfields.put(leafId, new TreeMap<>());
        }
        if (value instanceof AnnotatedFieldValue annotated) {
            TreeMap<String, ColumnNode> children = subfields.get(leafId);
            for (String subfield : annotated.getSubfieldNames()) {
                if (!FieldValue.NON_SUBFIELDS.contains(subfield)) {
                    children.computeIfAbsent(subfield, s -> new ColumnNode(leafId + "/" + s, s));
                }
            }
        }
    }

    /**
     * Consumes the sorted leaves sharing {@code parent}'s prefix, creating a category node per
     * next path segment. Ids sharing a prefix are contiguous once sorted.
     */
    private static void attach(ColumnNode parent, List<ColumnNode> sorted, int[] cursor) {
        String prefix = parent.getColumnNodeId();
        while (cursor[0] < sorted.size() && sorted.get(cursor[0]).getColumnNodeId().startsWith(prefix)) {
            ColumnNode leaf = sorted.get(cursor[0]);
            String rest = leaf.getColumnNodeId().substring(prefix.length());
            int slash = rest.indexOf('/');
            if (slash < 0) {
                parent.getChildren().add(leaf);
                cursor[0]++;
                continue;
            }
            String nodeName = rest.substring(0, slash);
            ColumnNode node = new ColumnNode(prefix + nodeName + "/", nodeName);
            attach(node, sorted, cursor);
            parent.getChildren().add(node);
        }
    }

    private void index(ColumnNode node) {
        Deque<ColumnNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            ColumnNode current = stack.pop();
            ColumnNode previous = nodes.putIfAbsent(current.getColumnNodeId(), current);
            if (previous != null) {
                log.debug("Duplicate column id {}, keeping the first node", current.getColumnNodeId());
            }
            current.getChildren().forEach(stack::push);
        }
    }

    public ColumnNode findNode(String columnNodeId) {
        return nodes.get(columnNodeId);
    }

    /**
     * Selects the given nodes. A category selects all of its descendants, a leaf selects only itself.
     * Unknown ids are ignored.
     */
    public void addSelection(Collection<String> columnNodeIds) {
        if (columnNodeIds == null) {
            return;
        }
        for (String id : columnNodeIds) {
            ColumnNode node = nodes.get(id);
            if (node == null) {
                log.debug("Ignoring selection of unknown column {}", id);
                continue;
            }
            walkDown(node, SelectionState.ALL);
        }
        propagateUp();
    }

    /**
     * Deselects the given nodes and every descendant, leaf subfields included. Unknown ids are ignored.
     */
    public void removeSelection(Collection<String> columnNodeIds) {
        if (columnNodeIds == null) {
            return;
        }
        for (String id : columnNodeIds) {
            ColumnNode node = nodes.get(id);
            if (node == null) {
                log.debug("Ignoring deselection of unknown column {}", id);
                continue;
            }
            walkDown(node, SelectionState.NONE);
        }
        propagateUp();
    }

    private static void walkDown(ColumnNode start, SelectionState state) {
        Deque<ColumnNode> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            ColumnNode node = stack.pop();
            if (node.getSelectionState() == state) {
                continue;
            }
            node.setSelectionState(state);
            if (state == SelectionState.ALL && node.isLeaf()) {
                continue;
            }
            node.getChildren().forEach(stack::push);
        }
    }

    private void propagateUp() {
        // Pre-order list reversed visits every child before its parent.
        List<ColumnNode> order = new ArrayList<>();
        Deque<ColumnNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ColumnNode node = stack.pop();
            order.add(node);
            node.getChildren().forEach(stack::push);
        }
        for (int i = order.size() - 1; i >= 0; i--) {
            order.get(i).updateSelectionState();
        }
    }

    /**
     * Selected leaves and leaf subfields in tree order. Units are left unset.
     */
    public List<TableColumn> getSelection() {
        List<TableColumn> columns = new ArrayList<>();
        collect(root, columns);
        return columns;
    }

    private static void collect(ColumnNode node, List<TableColumn> columns) {
        if (node.getSelectionState() == SelectionState.NONE) {
            return;
        }
        if (node.isLeaf() && node.getSelectionState() == SelectionState.ALL) {
            columns.add(TableColumn.builder()
                    .columnId(node.getColumnNodeId())
                    .name(displayName(node.getColumnNodeId()))
                    .description(node.getDescription())
                    .build());
        }
        for (ColumnNode child : node.getChildren()) {
            collect(child, columns);
        }
    }

    public static String displayName(String columnId) {
        if (columnId.startsWith(METADATA_PREFIX)) {
            return columnId.substring(METADATA_PREFIX.length());
        }
        if (columnId.startsWith(METRICS_PREFIX)) {
            return columnId.substring(METRICS_PREFIX.length());
        }
        return columnId;
    }
}
