package org.dxworks.notebookdeps.analyzer;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    private TreeSitterHelper() {}

    /**
     * Extracts the text of a node. Tree-sitter reports UTF-8 byte offsets while Java strings are
     * UTF-16, so the caller passes the UTF-8 encoding of the source once instead of per node.
     */
    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (node == null || node.isNull()) return null;
        int startByte = Math.max(0, node.getStartByte());
        int endByte = Math.min(sourceBytes.length, node.getEndByte());
        if (startByte >= endByte) return "";
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    public static byte[] utf8(String source) {
        return source.getBytes(StandardCharsets.UTF_8);
    }

    public static boolean isPresent(TSNode node) {
        return node != null && !node.isNull();
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (!isPresent(parent)) return null;
        // getFieldNameForChild(i) indexes all children, anonymous tokens included
        for (int i = 0; i < parent.getChildCount(); i++) {
            if (fieldName.equals(parent.getFieldNameForChild(i))) {
                return parent.getChild(i);
            }
        }
        return null;
    }

    /**
     * All children carrying the given field name, in source order. Some fields repeat
     * (e.g. {@code name} in {@code from m import a, b}).
     */
    public static List<TSNode> getChildrenByFieldName(TSNode parent, String fieldName) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(parent)) return result;
        for (int i = 0; i < parent.getChildCount(); i++) {
            if (fieldName.equals(parent.getFieldNameForChild(i))) {
                result.add(parent.getChild(i));
            }
        }
        return result;
    }

    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(parent)) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (isPresent(child)) result.add(child);
        }
        return result;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (!isPresent(node)) return false;
        return isTypeOneOf(node.getType(), types);
    }

    /**
     * First {@code ERROR} or {@code MISSING} node in source order, or null when the tree is clean.
     * Anonymous children are searched too since missing tokens are usually punctuation.
     */
    public static TSNode findFirstErrorNode(TSNode root) {
        if (!isPresent(root) || !root.hasError()) return null;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (!isPresent(node)) continue;
            if ("ERROR".equals(node.getType()) || node.isMissing()) {
                return node;
            }
            if (!node.hasError()) continue;
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
        }
        return root;
    }
}
