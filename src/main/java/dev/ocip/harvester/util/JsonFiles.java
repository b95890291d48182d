package dev.ocip.harvester.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Reading and writing of the JSON documents the harvester keeps on disk */
public class JsonFiles {

	private static final ObjectMapper readMapper = JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();

	private static final ObjectMapper writeMapper = JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	public static ObjectMapper mapper() {
		return readMapper;
	}

	public static <T> T read(Path file, Class<T> type) throws IOException {
		return readMapper.readValue(file.toFile(), type);
	}

	public static <T> T read(Path file, TypeReference<T> type) throws IOException {
		return readMapper.readValue(file.toFile(), type);
	}

	/** Read a JSON array document, an absent file reads as an empty list */
	public static <T> List<T> readList(Path file, TypeReference<List<T>> type) throws IOException {
		if (!Files.exists(file)) {
			return List.of();
		}
		return readMapper.readValue(file.toFile(), type);
	}

	public static JsonNode readTree(Path file) throws IOException {
		return readMapper.readTree(file.toFile());
	}

	public static String toJson(Object value) throws IOException {
		return writeMapper.writeValueAsString(value);
	}

	/** Serialize the value and replace the file with it atomically */
	public static void writeAtomically(Path file, Object value) throws IOException {
		byte[] content = writeMapper.writeValueAsBytes(value);
		byte[] withNewline = new byte[content.length + 1];
		System.arraycopy(content, 0, withNewline, 0, content.length);
		withNewline[content.length] = '\n';
		FileUtils.writeAtomically(file, withNewline);
	}

	/** Number of entries in a JSON array document, -1 if the file is absent or not an array */
	public static int countEntries(Path file) throws IOException {
		if (!Files.exists(file)) {
			return -1;
		}
		JsonNode node = readTree(file);
		return node.isArray() ? node.size() : -1;
	}
}
