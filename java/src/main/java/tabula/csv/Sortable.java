/**
 * Sortable.java
 */
package tabula.csv;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * In-place sort of the records an ordering stage has read.
 *
 * <p>Three-way quicksort: a partition gathers every element equal to the pivot
 * and leaves it out of the recursion, so columns with few distinct values
 * sort quickly. Short ranges fall back to insertion sort.</p>
 *
 * <p>Not stable: elements the comparator finds equal may come out in any
 * order, each exactly once.</p>
 */
final class Sortable {
	private static final int INSERTION_THRESHOLD = 16;

	private Sortable() {
	}

	static <T> void sort(final List<T> list, final Comparator<? super T> comparator) {
		sort(list, 0, list.size() - 1, comparator);
	}

	private static <T> void sort(final List<T> list, int low, int high, final Comparator<? super T> comparator) {
		while (high - low >= INSERTION_THRESHOLD) {
			Collections.swap(list, low, low + (high - low) / 2);
			final T pivot = list.get(low);
			// [low, lt) < pivot, [lt, i) == pivot, (gt, high] > pivot
			int lt = low, i = low + 1, gt = high;
			while (i <= gt) {
				final int d = comparator.compare(list.get(i), pivot);
				if (d < 0)
					Collections.swap(list, lt++, i++);
				else if (d > 0)
					Collections.swap(list, i, gt--);
				else
					i++;
			}
			// recurse into the smaller side, loop over the larger one
			if (lt - low < high - gt) {
				sort(list, low, lt - 1, comparator);
				low = gt + 1;
			} else {
				sort(list, gt + 1, high, comparator);
				high = lt - 1;
			}
		}
		for (int i = low + 1; i <= high; i++) {
			final T v = list.get(i);
			int j = i - 1;
			for (; j >= low && comparator.compare(list.get(j), v) > 0; j--)
				list.set(j + 1, list.get(j));
			list.set(j + 1, v);
		}
	}
}
