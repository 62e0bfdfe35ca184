package com.cyclerprotocol.loader.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** An element of a parsed procedure document. Text is decoded and stripped; empty elements have empty text. */
public final class XmlElementNode {
    private final String name;
    private final Map<String, String> attributes;
    private final List<XmlElementNode> children;
    private final String text;
    private final int line;
    private final int column;

    public XmlElementNode(
            String name,
            Map<String, String> attributes,
            List<XmlElementNode> children,
            String text,
            int line,
            int column) {
        this.name = Objects.requireNonNull(name, "name");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = List.copyOf(children);
        this.text = text == null ? "" : text;
        this.line = line;
        this.column = column;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public List<XmlElementNode> getChildren() {
        return children;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** First child with the given name, or {@code null}. */
    public XmlElementNode child(String childName) {
        for (XmlElementNode child : children) {
            if (child.name.equals(childName)) {
                return child;
            }
        }
        return null;
    }

    public List<XmlElementNode> children(String childName) {
        List<XmlElementNode> matches = new ArrayList<>();
        for (XmlElementNode child : children) {
            if (child.name.equals(childName)) {
                matches.add(child);
            }
        }
        return matches;
    }

    /** Text of the named child, or {@code null} when the child is absent. */
    public String childText(String childName) {
        XmlElementNode child = child(childName);
        return child == null ? null : child.text;
    }

    /** Follows a path of child names from this element. */
    public XmlElementNode path(String... names) {
        XmlElementNode current = this;
        for (String next : names) {
            current = current.child(next);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public String location() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return "<" + name + "> @ " + location();
    }
}
