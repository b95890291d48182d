package dev.ocip.harvester.portal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import dev.ocip.harvester.category.Category;
import dev.ocip.harvester.model.FailureReason;
import dev.ocip.harvester.model.PartitionRef;
import dev.ocip.harvester.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves previously captured portal pages from a directory tree:
 *
 * <pre>
 * &lt;root&gt;/&lt;category&gt;/partitions.json              ["Inst-A", "Inst-B"]
 * &lt;root&gt;/&lt;category&gt;/list/&lt;partition&gt;/page-0.json  {"rows": [...], "hasNextPage": true}
 * &lt;root&gt;/&lt;category&gt;/list/page-0.json              (unpartitioned categories)
 * &lt;root&gt;/&lt;category&gt;/detail/index.json             {"&lt;detail url&gt;": "file.json"}
 * &lt;root&gt;/&lt;category&gt;/detail/file.json              {"Section": {...} | [...] | {"$error": "..."}}
 * </pre>
 *
 * A {@code SESSION_EXPIRED} file in the root or category directory invalidates the session. A
 * page holding {@code {"$error": "...", "$reason": "TIMEOUT"}} fails with a retryable error.
 */
public class SnapshotPortal implements Portal {
	private static final Logger logger = LoggerFactory.getLogger(SnapshotPortal.class);

	static final String SESSION_MARKER = "SESSION_EXPIRED";
	private static final String ERROR = "$error";
	private static final String REASON = "$reason";

	private final Path root;

	public SnapshotPortal(Path root) {
		this.root = root;
	}

	@Override
	public PortalSession open(Category category) throws PortalException {
		Path dir = root.resolve(category.id());
		if (!Files.isDirectory(dir)) {
			throw new PageUnavailableException("No snapshot for " + category.id() + " in " + root);
		}
		logger.info("Opened snapshot session for {} at {}", category.id(), dir);
		return new SnapshotSession(category, dir);
	}

	public static class Discovery implements Portal.Discovery {
		@Override
		public String name() {
			return "snapshot";
		}

		@Override
		public Portal create(Path location) {
			return new SnapshotPortal(location);
		}
	}

	private class SnapshotSession implements PortalSession {
		private final Category category;
		private final Path dir;
		private volatile boolean closed;
		private Map<String, String> detailIndex;

		SnapshotSession(Category category, Path dir) {
			this.category = category;
			this.dir = dir;
		}

		@Override
		public boolean isValid() {
			return !closed
					&& !Files.exists(root.resolve(SESSION_MARKER))
					&& !Files.exists(dir.resolve(SESSION_MARKER));
		}

		@Override
		public List<PartitionRef> listPartitions() throws PortalException {
			checkSession();
			if (!category.partitioned()) {
				return List.of(PartitionRef.global());
			}
			Path file = dir.resolve("partitions.json");
			try {
				if (Files.exists(file)) {
					List<String> labels = JsonFiles.read(file, new TypeReference<List<String>>() {});
					return labels.stream().map(PartitionRef::of).toList();
				}
				Path listDir = dir.resolve("list");
				if (!Files.isDirectory(listDir)) {
					return List.of();
				}
				try (Stream<Path> children = Files.list(listDir)) {
					return children.filter(Files::isDirectory)
							.map(p -> PartitionRef.of(p.getFileName().toString()))
							.sorted(PartitionRef.BY_LABEL)
							.toList();
				}
			} catch (IOException e) {
				throw new PageUnavailableException("Cannot read partitions of " + category.id(), e);
			}
		}

		@Override
		public ListPage fetchListPage(PartitionRef partition, int pageIndex) throws PortalException {
			checkSession();
			Path listDir = dir.resolve("list");
			if (!partition.isGlobal()) {
				listDir = listDir.resolve(fileSafe(partition.label()));
			}
			JsonNode page = readPage(listDir.resolve("page-" + pageIndex + ".json"));
			List<Map<String, String>> rows = new ArrayList<>();
			for (JsonNode row : page.path("rows")) {
				Map<String, String> fields = new LinkedHashMap<>();
				Iterator<Map.Entry<String, JsonNode>> it = row.fields();
				while (it.hasNext()) {
					Map.Entry<String, JsonNode> field = it.next();
					fields.put(field.getKey(), field.getValue().isNull() ? "" : field.getValue().asText());
				}
				rows.add(fields);
			}
			return new ListPage(rows, page.path("hasNextPage").asBoolean(false));
		}

		@Override
		public DetailPage fetchDetailPage(String url) throws PortalException {
			checkSession();
			String fileName = detailIndex().get(url);
			if (fileName == null) {
				throw new PageUnavailableException("No captured detail page for " + url);
			}
			JsonNode page = readPage(dir.resolve("detail").resolve(fileName));
			Map<String, SectionSource> sections = new LinkedHashMap<>();
			Iterator<Map.Entry<String, JsonNode>> it = page.fields();
			while (it.hasNext()) {
				Map.Entry<String, JsonNode> section = it.next();
				JsonNode content = section.getValue();
				if (content.isObject() && content.has(ERROR)) {
					sections.put(section.getKey(), SectionSource.failing(content.get(ERROR).asText()));
				} else {
					Object raw = JsonFiles.mapper().convertValue(content, Object.class);
					sections.put(section.getKey(), SectionSource.of(raw));
				}
			}
			return new DetailPage(sections);
		}

		@Override
		public void close() {
			closed = true;
		}

		private Map<String, String> detailIndex() throws PortalException {
			if (detailIndex == null) {
				Path file = dir.resolve("detail").resolve("index.json");
				try {
					detailIndex = Files.exists(file)
							? JsonFiles.read(file, new TypeReference<Map<String, String>>() {})
							: Map.of();
				} catch (IOException e) {
					throw new PageUnavailableException("Cannot read detail index of " + category.id(), e);
				}
			}
			return detailIndex;
		}

		private JsonNode readPage(Path file) throws PortalException {
			if (!Files.exists(file)) {
				throw new PageUnavailableException("No captured page " + dir.relativize(file));
			}
			JsonNode page;
			try {
				page = JsonFiles.readTree(file);
			} catch (IOException e) {
				throw new TransientPortalException(FailureReason.RENDER_FAILURE, "Unreadable page " + file, e);
			}
			if (page.has(ERROR) && page.size() <= 2) {
				FailureReason reason = FailureReason.valueOf(
						page.path(REASON).asText(FailureReason.TIMEOUT.name()));
				String message = page.get(ERROR).asText();
				if (reason.retryable()) {
					throw new TransientPortalException(reason, message);
				}
				throw new PortalException(reason, message);
			}
			return page;
		}

		private void checkSession() throws SessionExpiredException {
			if (!isValid()) {
				throw new SessionExpiredException("Snapshot session for " + category.id() + " has expired");
			}
		}
	}

	/** Directory name used for a partition label */
	static String fileSafe(String label) {
		return label.replaceAll("[^A-Za-z0-9._-]", "_");
	}
}
