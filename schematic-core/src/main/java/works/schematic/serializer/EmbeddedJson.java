package works.schematic.serializer;

import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * JSON text embedded in string values, as found in loosely typed input
 * and in storage columns holding nested values.
 */
public final class EmbeddedJson {
	private EmbeddedJson() { }

	/**
	 * @throws JacksonException if {@code text} isn't valid JSON
	 */
	public static Object parse(String text) {
		return MAPPER.readValue(text, Object.class);
	}

	/**
	 * @return the object {@code text} encodes; empty if it's not valid JSON or not an object
	 */
	@SuppressWarnings("unchecked")
	public static Optional<Map<String, Object>> parseObject(String text) {
		Object result;
		try {
			result = parse(text);
		} catch (JacksonException e) {
			LOGGER.debug("Ignoring unparseable embedded JSON: {}", e.getMessage());
			return Optional.empty();
		}
		if (result instanceof Map<?, ?> map) {
			return Optional.of((Map<String, Object>) map);
		}
		LOGGER.debug("Ignoring embedded JSON that is not an object");
		return Optional.empty();
	}

	public static String write(Object value) {
		return MAPPER.writeValueAsString(value);
	}

	private static final ObjectMapper MAPPER = JsonMapper.builder().build();
	private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddedJson.class);
}
