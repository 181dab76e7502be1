package tabula.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.File;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class TestcaseReaderClose {

	static final class CountingSource implements RawSource {
		final AtomicInteger opened = new AtomicInteger();
		final AtomicInteger closed = new AtomicInteger();
		final ListSource rows = ListSource.of( //
				new String[] { "k", "v" }, //
				new String[] { "a", "1" }, //
				new String[] { "b", "2" }, //
				new String[] { "c", "3" });

		@Override
		public Bom bom() {
			return Bom.NONE;
		}

		@Override
		public char enclosure() {
			return '"';
		}

		@Override
		public Cursor<String[]> rows() {
			opened.incrementAndGet();
			final Cursor<String[]> cursor = rows.rows();
			return new Cursor<String[]>() {
				private boolean done = false;

				@Override
				public String[] next() {
					return cursor.next();
				}

				@Override
				public void close() {
					if (!done)
						closed.incrementAndGet();
					done = true;
				}
			};
		}
	}

	@Test
	void testcase_unfinished_iterations_closed_with_reader() throws Exception {
		final CountingSource source = new CountingSource();
		try (CsvReader reader = CsvReader.open(source)) {
			for (final Record r : reader) {
				assertEquals("k", r.get(0));
				break;
			}
			assertEquals("k", reader.fetchColumn(0).next());
			final Iterator<Map.Entry<String, String>> pairs = reader.fetchPairs(0, 1);
			assertEquals("v", pairs.next().getValue());
			assertEquals(3, source.opened.get());
			assertEquals(0, source.closed.get());
		}
		assertEquals(3, source.opened.get());
		assertEquals(3, source.closed.get());
	}

	@Test
	void testcase_drained_iterations_are_released() throws Exception {
		final CountingSource source = new CountingSource();
		final CsvReader reader = CsvReader.open(source).headerOffset(0);
		int n = 0;
		for (final Record r : reader)
			n += r.size();
		assertEquals(6, n);
		final Iterator<String> values = reader.fetchColumn("v");
		while (values.hasNext())
			values.next();
		assertEquals(source.opened.get(), source.closed.get());
		reader.close();
		assertEquals(source.opened.get(), source.closed.get());
	}

	@Test
	void testcase_text_source_closes_open_cursors() throws Exception {
		final TextSource source = TextSource.open(resource("people.csv"));
		try (CsvReader reader = CsvReader.open(source).headerOffset(0)) {
			for (final Record r : reader) {
				assertEquals("Ann", r.get("name"));
				break;
			}
			assertEquals(1, source.openCursors());
		}
		assertEquals(0, source.openCursors());
	}

	@Test
	void testcase_text_source_cursor_after_close() throws Exception {
		final TextSource source = TextSource.fromString("a\nb\nc\n");
		final Cursor<String[]> cursor = source.rows();
		assertEquals("a", cursor.next()[0]);
		source.close();
		assertEquals(0, source.openCursors());
		assertNull(cursor.next());
		// the source can still be read from the start
		assertEquals("c", source.seek(2)[0]);
		assertEquals(0, source.openCursors());
	}

	static File resource(final String name) throws Exception {
		return TestcaseTextSource.resource(name);
	}
}
