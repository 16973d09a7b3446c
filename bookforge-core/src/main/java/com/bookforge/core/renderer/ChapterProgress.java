package com.bookforge.core.renderer;

import com.bookforge.core.error.RenderException;

import java.util.Objects;

/**
 * Rendering progress of one chapter.
 *
 * <pre>
 * NOT_STARTED -> RENDERING_HEADER -> RENDERING_BODY -> DONE
 *            \_________________________/
 *              (no header: hidden or untitled)
 * </pre>
 *
 * <p>{@code DONE} is reached only when every footnote reference of the chapter resolved.
 */
public final class ChapterProgress {

    /**
     * Chapter rendering states.
     */
    public enum State {
        NOT_STARTED,
        RENDERING_HEADER,
        RENDERING_BODY,
        DONE
    }

    private final ResolvedChapter chapter;
    private final String format;
    private State state = State.NOT_STARTED;

    public ChapterProgress(ResolvedChapter chapter, String format) {
        this.chapter = Objects.requireNonNull(chapter, "chapter must not be null");
        this.format = format;
    }

    public State state() {
        return state;
    }

    /**
     * Enters the header state.
     *
     * @throws IllegalStateException if the chapter has no header or rendering already started
     */
    public void beginHeader() {
        expect(State.NOT_STARTED);
        if (!chapter.hasHeader()) {
            throw new IllegalStateException("chapter " + chapter.ordinal() + " has no header to render");
        }
        state = State.RENDERING_HEADER;
    }

    /**
     * Enters the body state, from the header or directly when there is no header.
     */
    public void beginBody() {
        if (state != State.NOT_STARTED && state != State.RENDERING_HEADER) {
            throw new IllegalStateException("cannot start body in state " + state);
        }
        if (state == State.NOT_STARTED && chapter.hasHeader()) {
            throw new IllegalStateException("chapter " + chapter.ordinal() + " header was not rendered");
        }
        state = State.RENDERING_BODY;
    }

    /**
     * Completes the chapter.
     *
     * @param footnotes footnotes referenced while rendering the body
     * @throws RenderException if a footnote reference has no definition
     */
    public void finish(FootnoteIndex footnotes) throws RenderException {
        expect(State.RENDERING_BODY);
        if (!footnotes.unresolved().isEmpty()) {
            throw new RenderException(format, chapter.index(),
                "unresolved footnote reference: [^" + footnotes.unresolved().iterator().next() + "]", null);
        }
        state = State.DONE;
    }

    private void expect(State expected) {
        if (state != expected) {
            throw new IllegalStateException("expected state " + expected + " but was " + state);
        }
    }
}
