package org.abstractica.debugclient.impl.correlation;

import java.util.Random;
import java.util.function.IntPredicate;

/**
 * Per-session source of request tokens.
 *
 * <p>Tokens are pseudo-random in {@code 1..Integer.MAX_VALUE - 1}; 0 is reserved
 * for server notifications. A token rejected by the caller's in-use check is
 * redrawn, so no two outstanding requests share a token.</p>
 *
 * <p>Not thread-safe; callers synchronize.</p>
 */
public final class TokenGenerator
{
    private final Random random;

    /**
     * Creates a generator with the given seed.
     *
     * @param seed the seed
     */
    public TokenGenerator(long seed)
    {
        this.random = new Random(seed);
    }

    /**
     * Returns the next token not rejected by {@code inUse}.
     *
     * @param inUse returns true for tokens that must not be issued
     * @return the token
     */
    public int next(IntPredicate inUse)
    {
        int token;
        do
        {
            token = 1 + random.nextInt(Integer.MAX_VALUE - 1);
        }
        while (inUse.test(token));
        return token;
    }
}
