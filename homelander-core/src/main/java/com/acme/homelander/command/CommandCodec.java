package com.acme.homelander.command;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

/**
 * Jackson codec for {@code {"command": "action.devices.commands.X", "params": {...}}} entries. A
 * missing or null params object reads as {@code {}}, which commands with required parameters
 * reject.
 */
public final class CommandCodec {
  static final String COMMAND = "command";
  static final String PARAMS = "params";

  private CommandCodec() {}

  public static class Deserializer extends StdDeserializer<Command> {
    public Deserializer() {
      super(Command.class);
    }

    @Override
    public Command deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = p.readValueAsTree();
      JsonNode name = node.get(COMMAND);
      if (name == null || !name.isTextual()) {
        throw MismatchedInputException.from(
            p, Command.class, "Execution entry without a command name");
      }
      Class<? extends Command> type =
          CommandCatalog.typeOf(name.asText())
              .orElseThrow(
                  () ->
                      InvalidTypeIdException.from(
                          p,
                          "Unknown command: " + name.asText(),
                          ctxt.constructType(Command.class),
                          name.asText()));
      JsonNode params = node.get(PARAMS);
      if (params == null || params.isNull()) {
        params = ctxt.getNodeFactory().objectNode();
      }
      return ctxt.readTreeAsValue(params, type);
    }
  }

  public static class Serializer extends StdSerializer<Command> {
    public Serializer() {
      super(Command.class);
    }

    @Override
    public void serialize(Command value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      gen.writeStringField(COMMAND, CommandCatalog.nameOf(value));
      gen.writeFieldName(PARAMS);
      provider.defaultSerializeValue(value, gen);
      gen.writeEndObject();
    }
  }
}
