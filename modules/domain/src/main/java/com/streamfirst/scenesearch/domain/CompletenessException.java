package com.streamfirst.scenesearch.domain;

import java.util.List;
import lombok.Getter;

/**
 * One or more scenes lack a data-take neighbor that the reference catalog knows about. Raised once
 * per verification run with one report line per affected scene.
 */
@Getter
public class CompletenessException extends SceneSearchException {

    private final List<String> missing;

    public CompletenessException(List<String> missing) {
        super("missing the following scenes:\n - " + String.join("\n - ", missing));
        this.missing = List.copyOf(missing);
    }
}
