/**
 * GitHub Changelog core package.
 *
 * <p>
 * Resolves the commit range of a release, classifies its commits, interprets an optional
 * AI analysis and assembles the changelog that replaces the release body.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.changelog;

import org.jspecify.annotations.NullMarked;
