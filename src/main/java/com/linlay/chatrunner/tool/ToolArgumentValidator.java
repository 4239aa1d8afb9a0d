package com.linlay.chatrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses the raw argument string of a tool call and checks it against the tool's JSON schema.
 */
@Component
public class ToolArgumentValidator {

    private final ObjectMapper objectMapper;
    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final Map<String, JsonSchema> schemasByTool = new ConcurrentHashMap<>();

    public ToolArgumentValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Result validate(ChatTool tool, String rawArguments) {
        JsonNode arguments;
        try {
            arguments = rawArguments == null || rawArguments.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(rawArguments);
        } catch (Exception ex) {
            return Result.invalid(List.of("arguments are not valid JSON"));
        }
        if (arguments == null || !arguments.isObject()) {
            return Result.invalid(List.of("arguments must be a JSON object"));
        }

        JsonSchema schema = schemasByTool.computeIfAbsent(tool.name(),
                name -> schemaFactory.getSchema(objectMapper.valueToTree(tool.parametersSchema())));
        Set<ValidationMessage> messages = schema.validate(arguments);
        if (!messages.isEmpty()) {
            return Result.invalid(messages.stream().map(ValidationMessage::getMessage).sorted().toList());
        }
        return Result.valid(arguments);
    }

    public record Result(
            JsonNode arguments,
            List<String> errors
    ) {

        public Result {
            errors = errors == null ? List.of() : List.copyOf(errors);
        }

        static Result valid(JsonNode arguments) {
            return new Result(arguments, List.of());
        }

        static Result invalid(List<String> errors) {
            return new Result(null, errors);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }
    }
}
