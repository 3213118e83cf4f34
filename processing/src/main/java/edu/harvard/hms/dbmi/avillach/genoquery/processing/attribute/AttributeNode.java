package edu.harvard.hms.dbmi.avillach.genoquery.processing.attribute;

import java.util.List;

/**
 * Parsed attribute query with every name already resolved to its bit mask.
 */
public sealed interface AttributeNode permits AttributeNode.Literal, AttributeNode.And, AttributeNode.Or,
        AttributeNode.Not {

    /**
     * @param value the OR of the attribute values present on an allele
     */
    boolean matches(int value);

    record Literal(String name, int mask) implements AttributeNode {
        public boolean matches(int value) {
            return (value & mask) != 0;
        }
    }

    record And(List<AttributeNode> children) implements AttributeNode {
        public And {
            children = List.copyOf(children);
        }

        public boolean matches(int value) {
            return children.stream().allMatch(child -> child.matches(value));
        }
    }

    record Or(List<AttributeNode> children) implements AttributeNode {
        public Or {
            children = List.copyOf(children);
        }

        public boolean matches(int value) {
            return children.stream().anyMatch(child -> child.matches(value));
        }
    }

    record Not(AttributeNode child) implements AttributeNode {
        public boolean matches(int value) {
            return !child.matches(value);
        }
    }
}
