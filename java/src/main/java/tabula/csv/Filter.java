/**
 * Provides filtering and ordering of records
 */
package tabula.csv;

import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Record predicates and comparators
 */
public final class Filter {

	/** Constant for ascending sort order */
	public static final int ASCENDING = 1;
	/** Constant for descending sort order */
	public static final int DESCENDING = -1;

	private Filter() {
	}

	/**
	 * Predicate accepting every record
	 */
	public static final Predicate<Record> ALL = new Predicate<>() {
		@Override
		public boolean test(final Record r) {
			return true;
		}

		@Override
		public String toString() {
			return "ALL";
		}
	};

	/**
	 * Conjunction of predicates, evaluated in order and short-circuited.
	 * A predicate that throws fails the whole evaluation with CALLBACK_FAILED.
	 */
	public static Predicate<Record> and(final List<Predicate<Record>> predicates) {
		if (predicates.isEmpty())
			return ALL;
		final Predicate<Record>[] a = toArray(predicates);
		return new Predicate<>() {
			@Override
			public boolean test(final Record r) {
				for (final Predicate<Record> p : a) {
					if (!invoke(p, r))
						return false;
				}
				return true;
			}

			@Override
			public String toString() {
				return "WHERE " + a.length + " predicate(s)";
			}
		};
	}

	/**
	 * Tie-break chain: the first comparator returning non-zero decides.
	 * A comparator that throws fails the whole sort with CALLBACK_FAILED.
	 */
	public static Comparator<Record> chain(final List<Comparator<Record>> comparators) {
		@SuppressWarnings("unchecked")
		final Comparator<Record>[] a = comparators.toArray(new Comparator[0]);
		return new Comparator<>() {
			@Override
			public int compare(final Record o1, final Record o2) {
				for (final Comparator<Record> c : a) {
					final int d = invoke(c, o1, o2);
					if (d != 0)
						return d;
				}
				return 0;
			}

			@Override
			public String toString() {
				return "ORDER BY " + a.length + " comparator(s)";
			}
		};
	}

	/**
	 * Compares the text of one column, nulls first
	 *
	 * @param column header name
	 * @param order  {@link #ASCENDING} or {@link #DESCENDING}
	 */
	public static Comparator<Record> column(final String column, final int order) {
		final Comparator<String> c = Comparator.nullsFirst(Comparator.<String>naturalOrder());
		return (o1, o2) -> order * c.compare(o1.get(column), o2.get(column));
	}

	/**
	 * Compares one column numerically, empty and null values first
	 */
	public static Comparator<Record> numeric(final String column, final int order) {
		final Comparator<Double> c = Comparator.nullsFirst(Comparator.<Double>naturalOrder());
		return (o1, o2) -> order * c.compare(number(o1.get(column)), number(o2.get(column)));
	}

	private static Double number(final String s) {
		return (s == null || s.isBlank()) ? null : Double.valueOf(s.trim());
	}

	static boolean invoke(final Predicate<Record> p, final Record r) {
		try {
			return p.test(r);
		} catch (RuntimeException ex) {
			if (ex instanceof CsvException && ((CsvException) ex).category() == ErrorCode.Category.CALLBACK)
				throw ex;
			throw new CsvException(ErrorCode.CALLBACK_FAILED, (Object) r, ex);
		}
	}

	static int invoke(final Comparator<Record> c, final Record o1, final Record o2) {
		try {
			return c.compare(o1, o2);
		} catch (RuntimeException ex) {
			if (ex instanceof CsvException && ((CsvException) ex).category() == ErrorCode.Category.CALLBACK)
				throw ex;
			throw new CsvException(ErrorCode.CALLBACK_FAILED, o1 + " <> " + o2, ex);
		}
	}

	@SuppressWarnings("unchecked")
	private static Predicate<Record>[] toArray(final List<Predicate<Record>> predicates) {
		return predicates.toArray(new Predicate[0]);
	}
}
