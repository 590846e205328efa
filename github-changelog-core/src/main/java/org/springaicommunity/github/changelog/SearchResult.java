package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a paginated listing.
 *
 * @param <T> the type of items in the page
 * @param items the items of this page
 * @param nextPage number of the next page (null if this is the last page)
 * @param hasMore whether more pages are available
 */
public record SearchResult<T>(List<T> items, @Nullable Integer nextPage, boolean hasMore) {

	public SearchResult {
		items = List.copyOf(items);
	}

	/**
	 * Create an empty result with no more pages.
	 * @param <T> the item type
	 * @return empty SearchResult
	 */
	public static <T> SearchResult<T> empty() {
		return new SearchResult<>(List.of(), null, false);
	}

}
