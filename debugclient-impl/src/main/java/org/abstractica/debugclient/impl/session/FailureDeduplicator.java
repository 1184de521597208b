package org.abstractica.debugclient.impl.session;

import java.util.Objects;

/**
 * Suppresses repeated reports of the same failure.
 *
 * <p>A failure's signature is the class and message of its root cause. Only
 * a signature that differs from the previous one is reported. Confined to
 * the connection thread.</p>
 */
final class FailureDeduplicator
{
    private String lastSignature;

    /**
     * Records a failure.
     *
     * @param failure the failure
     * @return true if it differs from the previously recorded one
     */
    boolean shouldReport(Throwable failure)
    {
        String signature = signatureOf(failure);
        if (signature.equals(lastSignature))
        {
            return false;
        }
        lastSignature = signature;
        return true;
    }

    /**
     * Forgets the previous failure so the next one is always reported.
     */
    void reset()
    {
        lastSignature = null;
    }

    static String signatureOf(Throwable failure)
    {
        Objects.requireNonNull(failure, "failure");

        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root)
        {
            root = root.getCause();
        }
        return root.getClass().getName() + ": " + root.getMessage();
    }
}
