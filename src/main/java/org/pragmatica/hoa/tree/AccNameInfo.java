package org.pragmatica.hoa.tree;

/**
 * Extra parameter of an {@code acc-name:} header.
 */
public sealed interface AccNameInfo {

    record StringValue(String value) implements AccNameInfo {
        @Override
        public String toString() {
            return value;
        }
    }

    record IntegerValue(int value) implements AccNameInfo {
        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    record BooleanValue(boolean value) implements AccNameInfo {
        @Override
        public String toString() {
            return value ? "t" : "f";
        }
    }
}
