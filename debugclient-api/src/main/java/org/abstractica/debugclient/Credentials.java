package org.abstractica.debugclient;

import java.util.Objects;

/**
 * User name and password presented to the debug server when a connection is opened.
 *
 * @param userName the user name
 * @param password the password
 */
public record Credentials(String userName, String password)
{
    public Credentials
    {
        Objects.requireNonNull(userName, "userName");
        Objects.requireNonNull(password, "password");
    }

    @Override
    public String toString()
    {
        return "Credentials[userName=" + userName + ", password=***]";
    }
}
