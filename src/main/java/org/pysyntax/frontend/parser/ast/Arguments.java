package org.pysyntax.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The parameter list of a function or lambda.
 * <p>
 * {@code defaults} belong to the last positional parameters (positional-only followed by regular),
 * while {@code kwDefaults} line up one-to-one with {@code kwonlyArgs} and hold null where a keyword-only
 * parameter has no default.
 *
 * @param posonlyArgs Parameters before {@code /}.
 * @param args Regular parameters.
 * @param vararg The {@code *args} parameter, or null.
 * @param kwonlyArgs Parameters after {@code *} or {@code *args}.
 * @param kwDefaults Defaults for the keyword-only parameters, null entries allowed.
 * @param kwarg The {@code **kwargs} parameter, or null.
 * @param defaults Defaults for the trailing positional parameters.
 */
public record Arguments(
        List<Arg> posonlyArgs,
        List<Arg> args,
        Arg vararg,
        List<Arg> kwonlyArgs,
        List<Expression> kwDefaults,
        Arg kwarg,
        List<Expression> defaults
) {

    /** An empty parameter list. */
    public static final Arguments EMPTY = new Arguments(null, null, null, null, null, null, null);

    public Arguments {
        posonlyArgs = AstLists.copy(posonlyArgs);
        args = AstLists.copy(args);
        kwonlyArgs = AstLists.copy(kwonlyArgs);
        defaults = AstLists.copy(defaults);
        if (kwDefaults == null || kwDefaults.isEmpty()) {
            List<Expression> padded = new ArrayList<>();
            for (int i = 0; i < kwonlyArgs.size(); i++) {
                padded.add(null);
            }
            kwDefaults = padded;
        }
        kwDefaults = AstLists.copyNullable(kwDefaults);
        if (kwDefaults.size() != kwonlyArgs.size()) {
            throw new IllegalArgumentException("kwDefaults must line up with kwonlyArgs: "
                    + kwDefaults.size() + " vs " + kwonlyArgs.size());
        }
        if (defaults.size() > posonlyArgs.size() + args.size()) {
            throw new IllegalArgumentException("More defaults than positional parameters");
        }
    }

    /**
     * @return True if there are no parameters at all.
     */
    public boolean isEmpty() {
        return posonlyArgs.isEmpty() && args.isEmpty() && vararg == null
                && kwonlyArgs.isEmpty() && kwarg == null;
    }
}
