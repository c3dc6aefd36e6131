package my.telemetryranker.app.util;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Guesses the delimiter from the header line: semicolon wins whenever it is present.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int lineEnd = sample.indexOf('\n');
		String header = lineEnd < 0 ? sample : sample.substring(0, lineEnd);
		return header.indexOf(';') >= 0 ? ';' : ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	public static String normalizeHeader(String header) {
		if (header == null) {
			return "";
		}
		return stripBom(header).trim().toLowerCase(Locale.ROOT);
	}

	/**
	 * Parses an ISO date, ignoring a trailing time part ("2024-01-05 10:00:00" or "2024-01-05T10:00").
	 */
	public static LocalDate parseDate(String raw) {
		String value = raw == null ? "" : raw.trim();
		if (value.length() > 10 && (value.charAt(10) == ' ' || value.charAt(10) == 'T')) {
			value = value.substring(0, 10);
		}
		try {
			return LocalDate.parse(value);
		} catch (DateTimeParseException ex) {
			throw new IllegalArgumentException("Invalid date: '" + raw + "'", ex);
		}
	}

	/**
	 * Parses a decimal that may use a comma as decimal separator. A value with both separators
	 * is read with the last one as the decimal separator.
	 */
	public static double parseDecimal(String raw) {
		String value = raw == null ? "" : raw.trim().replace(" ", "");
		if (value.isEmpty()) {
			throw new IllegalArgumentException("Missing numeric value");
		}
		int comma = value.lastIndexOf(',');
		int dot = value.lastIndexOf('.');
		if (comma >= 0 && dot >= 0) {
			value = comma > dot
					? value.replace(".", "").replace(',', '.')
					: value.replace(",", "");
		} else if (comma >= 0) {
			value = value.replace(',', '.');
		}
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException("Invalid number: '" + raw + "'", ex);
		}
	}
}
