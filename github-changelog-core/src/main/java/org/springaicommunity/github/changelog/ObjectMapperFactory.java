package org.springaicommunity.github.changelog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Factory for the {@link ObjectMapper} shared by the GitHub, chat-completion and
 * configuration codecs.
 *
 * <p>
 * All payloads are read and written through the tree model ({@code readTree},
 * {@code createObjectNode}), so no binding or naming configuration is applied.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper}.
	 * @return a tree-model mapper
	 */
	public static ObjectMapper create() {
		return JsonMapper.builder().build();
	}

}
