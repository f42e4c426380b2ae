package json.java17.dynamic;

/// JSON container a [DynamicTable] is written as.
public enum ContainerKind {
    ARRAY,
    OBJECT
}
