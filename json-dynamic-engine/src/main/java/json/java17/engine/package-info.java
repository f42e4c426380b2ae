/// Flag-driven JSON reader and writer whose document storage is charged to a
/// [json.java17.engine.BoundedAllocator].
///
/// [json.java17.engine.JsonReader] turns bytes into an immutable
/// [json.java17.engine.JsonDoc]; [json.java17.engine.JsonWriter] turns a
/// [json.java17.engine.JsonMutDoc] into bytes. Neither throws for malformed
/// input or exhausted memory: both report a result code and a message.
package json.java17.engine;
