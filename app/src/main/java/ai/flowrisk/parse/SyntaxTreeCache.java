package ai.flowrisk.parse;

import ai.flowrisk.analyzer.Language;
import ai.flowrisk.analyzer.SourceContent;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Holds at most one parsed tree per (content hash, language) for the lifetime of one analysis run.
 *
 * <p>Lookups for the same key are computed atomically: a caller that races an in-flight parse waits for it and receives
 * the same instance. Failed parses are not stored, so a later lookup parses again.
 */
public final class SyntaxTreeCache implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SyntaxTreeCache.class);

    private record TreeKey(String contentHash, Language language) {}

    private final SourceParser parser;
    private final Cache<TreeKey, ParsedTree> cache;

    public SyntaxTreeCache(SourceParser parser) {
        this.parser = parser;
        this.cache = Caffeine.newBuilder().recordStats().build();
    }

    public SyntaxTreeCache() {
        this(new TreeSitterSourceParser());
    }

    /**
     * Returns the cached tree for the key or parses {@code source} once and stores the result.
     *
     * @throws ParseFailureException when the parser fails; the failure is not cached
     */
    public ParsedTree getOrParse(String contentHash, Language language, SourceContent source)
            throws ParseFailureException {
        try {
            return cache.get(new TreeKey(contentHash, language), key -> {
                try {
                    return parser.parse(key.contentHash(), key.language(), source);
                } catch (ParseFailureException e) {
                    throw new ParseFailureWrapper(e);
                }
            });
        } catch (ParseFailureWrapper w) {
            logger.debug("Parse of {} content {} failed: {}", language, contentHash, w.getCause().getMessage());
            throw (ParseFailureException) w.getCause();
        }
    }

    public ParsedTree getOrParse(Language language, SourceContent source) throws ParseFailureException {
        return getOrParse(ContentHash.of(source.utf8Bytes()), language, source);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    @Override
    public void close() {
        logger.debug("Releasing syntax tree cache: {}", cache.stats());
        cache.invalidateAll();
    }

    /** Carries the checked parse failure out of Caffeine's mapping function. */
    private static final class ParseFailureWrapper extends RuntimeException {
        ParseFailureWrapper(ParseFailureException cause) {
            super(cause);
        }
    }
}
