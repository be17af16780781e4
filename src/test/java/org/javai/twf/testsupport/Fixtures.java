package org.javai.twf.testsupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads TWF sources from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

	private Fixtures() {
	}

	public static String read(String name) {
		String resource = "fixtures/" + name;
		try (InputStream stream = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
			if (stream == null) {
				throw new IllegalStateException("Could not load fixture: " + resource);
			}
			return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Could not read fixture: " + resource, e);
		}
	}
}
