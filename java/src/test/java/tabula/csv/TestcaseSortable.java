/**
 * 
 */
package tabula.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

/**
 *
 */
public class TestcaseSortable {

	static List<Integer> shuffled(final int n, final long seed) {
		final List<Integer> a = new ArrayList<>();
		for (int i = 0; i < n; i++)
			a.add(i % 97); // with duplicates
		Collections.shuffle(a, new Random(seed));
		return a;
	}

	@Test
	void testcase_basic_sort() {
		final List<Integer> a = shuffled(1024, 7L);
		final List<Integer> expected = new ArrayList<>(a);
		Collections.sort(expected);

		Sortable.sort(a, Comparator.naturalOrder());
		assertEquals(expected, a);
	}

	@Test
	void testcase_small_and_empty() {
		final List<Integer> empty = new ArrayList<>();
		Sortable.sort(empty, Comparator.naturalOrder());
		assertEquals(List.of(), empty);

		final List<Integer> small = new ArrayList<>(List.of(3, 1, 2));
		Sortable.sort(small, Comparator.reverseOrder());
		assertEquals(List.of(3, 2, 1), small);
	}

	@Test
	void testcase_each_element_kept_once() {
		for (long seed = 0; seed < 20; seed++) {
			final List<Integer> a = shuffled(300, seed);
			final List<Integer> expected = new ArrayList<>(a);
			Collections.sort(expected, Comparator.reverseOrder());
			Sortable.sort(a, Comparator.reverseOrder());
			assertEquals(expected, a);
		}
	}

	@Test
	void testcase_records_by_column() {
		final List<Record> records = new ArrayList<>();
		final Header header = Header.of("id", "grade");
		for (final int i : shuffled(500, 3L))
			records.add(Record.of(header, Integer.toString(i), Character.toString((char) ('A' + i % 3))));
		Sortable.sort(records, Filter.chain(List.of(Filter.column("grade", Filter.ASCENDING), Filter.numeric("id", Filter.DESCENDING))));

		for (int i = 1; i < records.size(); i++) {
			final Record p = records.get(i - 1);
			final Record r = records.get(i);
			final int d = p.get("grade").compareTo(r.get("grade"));
			assertTrue(d < 0 || (d == 0 && Integer.parseInt(p.get("id")) >= Integer.parseInt(r.get("id"))), p + " before " + r);
		}
	}

	@Test
	void testcase_inconsistent_comparator_terminates() {
		final List<Integer> a = shuffled(200, 11L);
		final List<Integer> expected = new ArrayList<>(a);
		Collections.sort(expected);
		Sortable.sort(a, (x, y) -> -1);
		Collections.sort(a);
		assertEquals(expected, a);
	}
}
