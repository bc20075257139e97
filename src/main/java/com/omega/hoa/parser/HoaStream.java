package com.omega.hoa.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.config.HoaParserConfig;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.model.ParseResult;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Pull-based sequence of the automata in one HOA text.
 *
 * Each call to {@link #next()} reads forward to the next {@code --END--} or {@code --ABORT--}
 * and yields exactly one result for that stretch of input. A {@code HOA:} line before the end
 * marker cuts the current automaton short and starts the next one, so a malformed automaton
 * never swallows its successors. The cursor cannot be rewound; create a new stream to restart.
 */
public class HoaStream implements Iterator<ParseResult> {
    private static final Logger log = LoggerFactory.getLogger(HoaStream.class);

    private final HoaLexer lexer;
    private final HoaPipeline pipeline;
    private final HoaParserConfig config;

    /** {@code HOA:} token that ended the previous automaton and starts the next. */
    private HoaToken carried;
    private ParseResult prefetched;
    private boolean exhausted;
    private int index;

    public HoaStream(String text, HoaParserConfig config, HoaPipeline pipeline) {
        this.lexer = new HoaLexer(text);
        this.config = config;
        this.pipeline = pipeline;
    }

    @Override
    public boolean hasNext() {
        if (prefetched == null && !exhausted) {
            prefetched = readNext();
        }
        return prefetched != null;
    }

    @Override
    public ParseResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No further automaton in stream");
        }
        ParseResult result = prefetched;
        prefetched = null;
        return result;
    }

    /**
     * Number of items produced so far.
     */
    public int getIndex() {
        return index;
    }

    private ParseResult readNext() {
        Diagnostics diagnostics = new Diagnostics(config.getMaxErrors());
        List<HoaToken> slice = new ArrayList<>();

        while (true) {
            HoaToken token = carried != null ? carried : lexer.next(diagnostics);
            carried = null;

            if (token.is(Type.EOF)) {
                exhausted = true;
                if (slice.isEmpty()) {
                    if (diagnostics.isEmpty()) {
                        return null;
                    }
                    // Only unreadable input was left.
                    log.warn("Trailing input could not be tokenized");
                    return ParseResult.failure(diagnostics.ranked());
                }
                slice.add(token);
                break;
            }
            if (token.isHeader("HOA") && !slice.isEmpty()) {
                carried = token;
                log.debug("New 'HOA:' at {} before the end of automaton #{}", token.getSpan(), index);
                break;
            }
            slice.add(token);
            if (token.is(Type.END) || token.is(Type.ABORT)) {
                break;
            }
        }

        return pipeline.process(slice, diagnostics, index++);
    }
}
