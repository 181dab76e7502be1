package tabula.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import org.junit.jupiter.api.Test;

public class TestcaseStatement {

	static CsvReader people() {
		return CsvReader.open(ListSource.of( //
				new String[] { "name", "age" }, //
				new String[] { "Ann", "30" }, //
				new String[] { "Bo", "25" }, //
				new String[] { "Cy", "41" }, //
				new String[] { "Di", "25" })) //
				.headerOffset(0);
	}

	static CsvReader numbers(final int n) {
		final List<String[]> rows = new ArrayList<>();
		for (int i = 0; i < n; i++)
			rows.add(new String[] { Integer.toString(i) });
		return CsvReader.open(ListSource.of(rows));
	}

	static List<String> names(final RecordSet rs) {
		final List<String> list = new ArrayList<>();
		for (final Record r : rs)
			list.add(r.get("name"));
		return list;
	}

	@Test
	void testcase_filter_without_header() {
		final CsvReader reader = CsvReader.open(ListSource.of( //
				new String[] { "a", "1" }, //
				new String[] { "b", "2" }, //
				new String[] { "c", "3" }));
		final List<Record> records = Statement.create() //
				.where(r -> !"2".equals(r.get(1))) //
				.offset(0) //
				.limit(-1) //
				.process(reader) //
				.all();
		assertEquals(2, records.size());
		assertEquals(List.of("a", "1"), records.get(0).values());
		assertEquals(List.of("c", "3"), records.get(1).values());
	}

	@Test
	void testcase_order_by_age() {
		final CsvReader reader = CsvReader.open(ListSource.of( //
				new String[] { "name", "age" }, //
				new String[] { "Ann", "30" }, //
				new String[] { "Bo", "25" })) //
				.headerOffset(0);
		final List<Record> records = Statement.create() //
				.orderBy(Filter.numeric("age", Filter.ASCENDING)) //
				.process(reader) //
				.all();
		final Header h = Header.of("name", "age");
		assertEquals(List.of(Record.of(h, "Bo", "25"), Record.of(h, "Ann", "30")), records);
	}

	@Test
	void testcase_order_by_tie_break() {
		final RecordSet rs = Statement.create() //
				.orderBy(Filter.numeric("age", Filter.ASCENDING)) //
				.orderBy(Filter.column("name", Filter.DESCENDING)) //
				.process(people());
		assertEquals(List.of("Di", "Bo", "Ann", "Cy"), names(rs));
	}

	@Test
	void testcase_filters_are_combined() {
		final Predicate<Record> young = r -> Integer.parseInt(r.get("age")) < 35;
		final Predicate<Record> notAnn = r -> !"Ann".equals(r.get("name"));
		final List<String> a = names(Statement.create().where(young).where(notAnn).process(people()));
		final List<String> b = names(Statement.create().where(notAnn).where(young).process(people()));
		assertEquals(List.of("Bo", "Di"), a);
		assertEquals(a, b);
	}

	@Test
	void testcase_offset_limit_window() {
		final int n = 7;
		for (int o = 0; o <= n + 1; o++) {
			for (int l = -1; l <= n + 1; l++) {
				final long count = Statement.create().offset(o).limit(l).process(numbers(n)).count();
				final long expected = l == -1 ? Math.max(0, n - o) : Math.max(0, Math.min(l, n - o));
				assertEquals(expected, count, "offset " + o + " limit " + l);
			}
		}
	}

	@Test
	void testcase_limit_stops_pulling() {
		final AtomicInteger tested = new AtomicInteger();
		final List<Record> records = Statement.create() //
				.where(r -> tested.incrementAndGet() > 0) //
				.limit(3) //
				.process(numbers(100)) //
				.all();
		assertEquals(3, records.size());
		assertEquals(3, tested.get());
	}

	@Test
	void testcase_window_pulls() {
		final AtomicInteger pulled = new AtomicInteger();
		final Cursor<Record> numbers = Cursor.of(numbers(5).fetchAll());
		final Cursor<Record> counting = () -> {
			final Record r = numbers.next();
			if (r != null)
				pulled.incrementAndGet();
			return r;
		};

		// empty window reads nothing
		assertNull(new Pipeline.Window(counting, 2, 0).next());
		assertEquals(0, pulled.get());

		final Pipeline.Window window = new Pipeline.Window(counting, 1, 2);
		assertEquals("1", window.next().get(0));
		assertEquals("2", window.next().get(0));
		assertNull(window.next());
		assertNull(window.next());
		assertEquals(3, pulled.get());

		// offset past the end
		final Pipeline.Window past = new Pipeline.Window(counting, 10, -1);
		assertNull(past.next());
		assertNull(past.next());
		assertEquals(5, pulled.get());
	}

	@Test
	void testcase_order_reads_everything_first() {
		final AtomicInteger tested = new AtomicInteger();
		final RecordSet rs = Statement.create() //
				.where(r -> tested.incrementAndGet() > 0) //
				.orderBy(Comparator.comparing((Record r) -> r.get(0)).reversed()) //
				.limit(1) //
				.process(numbers(10));
		assertEquals(10, tested.get());
		assertEquals("9", rs.one().get(0));
	}

	@Test
	void testcase_invalid_offset_and_limit() {
		final CsvException offset = assertThrows(CsvException.class, () -> Statement.create().offset(-1));
		assertEquals(ErrorCode.INVALID_OFFSET, offset.getErrorCode());
		final CsvException limit = assertThrows(CsvException.class, () -> Statement.create().limit(-2));
		assertEquals(ErrorCode.INVALID_LIMIT, limit.getErrorCode());
		assertEquals(ErrorCode.Category.VALIDATION, limit.category());
	}

	@Test
	void testcase_immutable() {
		final Statement s0 = Statement.create();
		final Statement s1 = s0.where(Filter.ALL).offset(2).limit(5);
		assertNotSame(s0, s1);
		assertTrue(s0.where().isEmpty());
		assertEquals(0, s0.offset());
		assertEquals(-1, s0.limit());

		final Statement s2 = s1.where(r -> true);
		assertEquals(1, s1.where().size());
		assertEquals(2, s2.where().size());

		assertSame(s1, s1.offset(2));
		assertSame(s1, s1.limit(5));
		assertThrows(UnsupportedOperationException.class, () -> s2.where().add(Filter.ALL));
	}

	@Test
	void testcase_duplicate_header_override() {
		final Statement s = Statement.create();
		final CsvException ex = assertThrows(CsvException.class, () -> s.header("a", "a"));
		assertEquals(ErrorCode.INVALID_HEADER, ex.getErrorCode());
		assertEquals(ErrorCode.Category.VALIDATION, ex.category());
		assertNull(s.header());
	}

	@Test
	void testcase_header_override() {
		final RecordSet rs = Statement.create() //
				.header("first", "second", "third") //
				.where(r -> "b".equals(r.get("first"))) //
				.process(CsvReader.open(ListSource.of( //
						new String[] { "a", "1" }, //
						new String[] { "b", "2" })));
		assertEquals(List.of("first", "second", "third"), rs.header().names());
		final Record r = rs.one();
		assertEquals("2", r.get("second"));
		assertNull(r.get("third"));
		assertTrue(r.contains("third"));
	}

	@Test
	void testcase_header_override_replaces_source_header() {
		final RecordSet rs = Statement.create() //
				.header("n") //
				.process(people());
		assertEquals(List.of("n"), rs.header().names());
		assertEquals("{n=Ann}", rs.one().map().toString());
	}

	@Test
	void testcase_columns() {
		final Map<String, String> aliases = new LinkedHashMap<>();
		aliases.put("age", "years");
		aliases.put("name", "who");
		final RecordSet rs = Statement.create() //
				.columns(aliases) //
				.offset(1) //
				.limit(1) //
				.process(people());
		assertEquals(List.of("years", "who"), rs.header().names());
		assertEquals("{years=25, who=Bo}", rs.one().map().toString());
	}

	@Test
	void testcase_columns_unknown() {
		final Statement s = Statement.create().columns("name", "email");
		final CsvException ex = assertThrows(CsvException.class, () -> s.process(people()));
		assertEquals(ErrorCode.UNKNOWN_COLUMN, ex.getErrorCode());
	}

	@Test
	void testcase_columns_by_position() {
		final RecordSet rs = Statement.create() //
				.columns("1", "5") //
				.process(CsvReader.open(ListSource.of(new String[] { "a", "b" })));
		final Record r = rs.one();
		assertEquals("b", r.get("1"));
		assertNull(r.get("5"));
	}

	@Test
	void testcase_columns_invalid() {
		assertEquals(ErrorCode.INVALID_ARGUMENT,
				assertThrows(CsvException.class, () -> Statement.create().columns("a", "a")).getErrorCode());
		assertEquals(ErrorCode.INVALID_ARGUMENT,
				assertThrows(CsvException.class, () -> Statement.create().columns("")).getErrorCode());
		final Statement s = Statement.create().columns("a");
		assertSame(s, s.columns("a"));
	}

	@Test
	void testcase_failing_filter() {
		final RecordSet rs = Statement.create() //
				.where(r -> Integer.parseInt(r.get("name")) > 0) //
				.process(people());
		final CsvException ex = assertThrows(CsvException.class, rs::all);
		assertEquals(ErrorCode.CALLBACK_FAILED, ex.getErrorCode());
		assertEquals(ErrorCode.Category.CALLBACK, ex.category());
		assertInstanceOf(NumberFormatException.class, ex.getCause());
		assertEquals(RecordSet.State.EXHAUSTED, rs.state());
	}

	@Test
	void testcase_failing_comparator() {
		final Statement s = Statement.create() //
				.orderBy(Filter.numeric("name", Filter.ASCENDING));
		final CsvException ex = assertThrows(CsvException.class, () -> s.process(people()));
		assertEquals(ErrorCode.CALLBACK_FAILED, ex.getErrorCode());
		assertInstanceOf(NumberFormatException.class, ex.getCause());
	}
}
