package dev.ocip.harvester.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Locale;
import java.util.UUID;

/** Utility class for file operations */
public class FileUtils {

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Get the size of a file in bytes, zero for a missing file */
	public static long getFileSize(Path file) throws IOException {
		return Files.exists(file) ? Files.size(file) : 0L;
	}

	/** Human readable size, e.g. "12.3 KB" */
	public static String formatSize(long bytes) {
		if (bytes < 1024) {
			return bytes + " B";
		}
		double value = bytes;
		String[] units = {"KB", "MB", "GB"};
		int unit = -1;
		while (value >= 1024 && unit < units.length - 1) {
			value /= 1024;
			unit++;
		}
		return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
	}

	/**
	 * Replace the target with the given content in one step. The content is written to a sibling
	 * temporary file first and then moved over the target, so readers see either the old or the new
	 * document, never a truncated one.
	 */
	public static void writeAtomically(Path target, byte[] content) throws IOException {
		Path dir = target.toAbsolutePath().getParent();
		ensureDirectory(dir);
		// Default permissions of a new file, not the owner-only mode of createTempFile
		Path tmp = Files.createFile(dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp"));
		try {
			keepPermissions(target, tmp);
			Files.write(tmp, content);
			try {
				Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(tmp);
		}
	}

	private static void keepPermissions(Path target, Path replacement) throws IOException {
		if (Files.exists(target)
				&& Files.getFileStore(replacement).supportsFileAttributeView(PosixFileAttributeView.class)) {
			Files.setPosixFilePermissions(replacement, Files.getPosixFilePermissions(target));
		}
	}
}
