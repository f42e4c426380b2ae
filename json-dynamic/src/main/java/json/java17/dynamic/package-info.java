/// Memory-bounded mapping between a dynamic value model and JSON.
///
/// [json.java17.dynamic.JsonDynamic] is the entry point. Values are
/// [json.java17.dynamic.DynamicValue]s, with [json.java17.dynamic.DynamicTable]
/// standing for both arrays and objects; the tokens of a
/// [json.java17.dynamic.SentinelRegistry] mark explicit nulls and say which
/// container kind a table is.
package json.java17.dynamic;
