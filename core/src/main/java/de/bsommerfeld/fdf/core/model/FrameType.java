package de.bsommerfeld.fdf.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Control kinds known to the editor, with the FDF type keyword each one is
 * written as. Several FDF keywords are aliases of the same control kind.
 */
public enum FrameType {

    ORIGIN("FRAME"),
    FRAME("FRAME"),
    BACKDROP("BACKDROP"),
    SIMPLEFRAME("SIMPLEFRAME"),

    TEXT_FRAME("TEXT", "TEXTBUTTON"),
    SIMPLEFONTSTRING("SIMPLEFONTSTRING"),
    TEXTAREA("TEXTAREA", "CHATDISPLAY"),

    BUTTON("BUTTON"),
    GLUETEXTBUTTON("GLUETEXTBUTTON"),
    GLUEBUTTON("GLUEBUTTON"),
    SIMPLEBUTTON("SIMPLEBUTTON"),
    BROWSER_BUTTON("BROWSER_BUTTON", "BROWSEBUTTON"),
    SCRIPT_DIALOG_BUTTON("SCRIPT_DIALOG_BUTTON", "SCRIPTDIALOGBUTTON"),
    INVIS_BUTTON("INVIS_BUTTON"),

    CHECKBOX("CHECKBOX", "GLUECHECKBOX", "SIMPLECHECKBOX"),
    EDITBOX("EDITBOX", "GLUEEDITBOX", "SLASHCHATBOX"),
    SLIDER("SLIDER"),
    SCROLLBAR("SCROLLBAR"),
    LISTBOX("LISTBOX"),
    MENU("MENU"),
    POPUPMENU("POPUPMENU", "GLUEPOPUPMENU"),

    SPRITE("SPRITE"),
    MODEL("MODEL"),
    HIGHLIGHT("HIGHLIGHT"),

    SIMPLESTATUSBAR("SIMPLESTATUSBAR"),
    STATUSBAR("STATUSBAR"),

    CONTROL("CONTROL"),
    DIALOG("DIALOG"),
    TIMERTEXT("TIMERTEXT");

    private static final Map<String, FrameType> BY_KEYWORD = Stream.of(values())
            .filter(t -> t != ORIGIN)
            .flatMap(t -> t.keywords.stream().map(k -> Map.entry(k, t)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private final String fdfName;
    private final Set<String> keywords;

    FrameType(String fdfName, String... aliases) {
        this.fdfName = fdfName;
        this.keywords = Stream.concat(Stream.of(fdfName), Stream.of(aliases))
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Canonical FDF keyword used when exporting this type. */
    public String fdfName() {
        return fdfName;
    }

    /** Text controls whose default height is a single text line. */
    public boolean isTextLike() {
        return this == TEXT_FRAME || this == SIMPLEFONTSTRING || this == TIMERTEXT;
    }

    /**
     * Maps an FDF type keyword (case- and whitespace-insensitive) to its control
     * kind. Unknown keywords yield an empty result; callers decide the fallback.
     */
    public static Optional<FrameType> fromFdf(String keyword) {
        if (keyword == null)
            return Optional.empty();
        String normalized = keyword.toUpperCase(Locale.ROOT).replaceAll("\\s+", "");
        return Optional.ofNullable(BY_KEYWORD.get(normalized));
    }
}
