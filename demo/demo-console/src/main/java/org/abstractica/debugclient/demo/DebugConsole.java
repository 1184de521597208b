package org.abstractica.debugclient.demo;

import org.abstractica.debugclient.ClientValue;
import org.abstractica.debugclient.Credentials;
import org.abstractica.debugclient.DebugSession;
import org.abstractica.debugclient.RemoteDebugException;
import org.abstractica.debugclient.SessionListener;
import org.abstractica.debugclient.impl.protocol.XmlDocuments;
import org.abstractica.debugclient.impl.session.DefaultDebugSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Interactive console for a remote debug server.
 *
 * <p>Every line that does not start with a colon is executed on the current
 * node. Meta-commands:</p>
 * <ul>
 *   <li>{@code :use <path>} selects a node</li>
 *   <li>{@code :members} lists the members of the current node</li>
 *   <li>{@code :list [-r]} prints the node tree</li>
 *   <li>{@code :timeout <ms>} changes the default request timeout</li>
 *   <li>{@code :quit} closes the session</li>
 * </ul>
 */
public class DebugConsole
{
    private static final Logger LOG = LoggerFactory.getLogger(DebugConsole.class);
    private static final String DEFAULT_URL = "http://localhost:8080/debug";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final DebugSession session;

    public DebugConsole(String url, Optional<Credentials> credentials, Duration timeout)
    {
        this.session = new DefaultDebugSessionFactory().builder()
                .serverUri(url)
                .credentialProvider(uri -> credentials)
                .defaultTimeout(timeout)
                .listener(new ConsoleListener())
                .build();
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        try
        {
            printPrompt();
            String line;
            while ((line = reader.readLine()) != null)
            {
                if (!handleLine(line.trim()))
                {
                    return;
                }
                printPrompt();
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private boolean handleLine(String line)
    {
        if (line.isEmpty())
        {
            return true;
        }
        if (!line.startsWith(":"))
        {
            printValues(await(session.execute(line)));
            return true;
        }

        String[] parts = line.split("\\s+", 2);
        String argument = parts.length > 1 ? parts[1] : "";
        switch (parts[0].toLowerCase())
        {
            case ":use" ->
            {
                if (argument.isEmpty())
                {
                    System.out.println("Usage: :use <path>");
                }
                else
                {
                    String path = await(session.use(argument));
                    if (path != null)
                    {
                        System.out.println("Using " + path);
                    }
                }
            }
            case ":members" -> printValues(await(session.listMembers()));
            case ":list" ->
            {
                Element tree = await(session.list("-r".equals(argument)));
                if (tree != null)
                {
                    System.out.println(XmlDocuments.toXml(tree));
                }
            }
            case ":timeout" -> setTimeout(argument);
            case ":quit", ":exit", ":q" ->
            {
                System.out.println("Disconnecting...");
                return false;
            }
            case ":help" ->
            {
                System.out.println("Commands:");
                System.out.println("  <command>        - Execute a command on the current node");
                System.out.println("  :use <path>      - Select a node");
                System.out.println("  :members         - List members of the current node");
                System.out.println("  :list [-r]       - List child nodes, -r for all descendants");
                System.out.println("  :timeout <ms>    - Set the request timeout, 0 for none");
                System.out.println("  :quit            - Disconnect and exit");
            }
            default -> System.out.println("Unknown command: " + parts[0] + " (type ':help' for commands)");
        }
        return true;
    }

    private void setTimeout(String argument)
    {
        try
        {
            session.setDefaultTimeout(Duration.ofMillis(Long.parseLong(argument)));
            System.out.println("Timeout set to " + session.getDefaultTimeout().toMillis() + " ms");
        }
        catch (NumberFormatException e)
        {
            System.out.println("Usage: :timeout <ms>");
        }
    }

    /**
     * Waits for a reply and prints failures.
     *
     * @return the reply, or null if the request failed
     */
    private <T> T await(CompletableFuture<T> reply)
    {
        try
        {
            return reply.join();
        }
        catch (CancellationException e)
        {
            System.out.println("Request cancelled (timed out or connection lost)");
        }
        catch (CompletionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof RemoteDebugException remote)
            {
                System.out.println(remote.getExceptionType() + ": " + remote.getMessage());
                remote.getRemoteStackTrace().ifPresent(trace -> LOG.debug("Remote stack trace:\n{}", trace));
            }
            else if (cause instanceof UncheckedIOException io)
            {
                System.out.println("Send failed: " + io.getCause().getMessage());
            }
            else
            {
                LOG.error("Request failed", cause);
            }
        }
        catch (IllegalStateException e)
        {
            System.out.println(e.getMessage());
        }
        return null;
    }

    private static void printValues(List<ClientValue> values)
    {
        if (values == null)
        {
            return;
        }
        for (ClientValue value : values)
        {
            System.out.printf("  %s : %s = %s%n", value.getName(), value.getTypeName(), value.getValueAsString());
        }
    }

    private void printPrompt()
    {
        String path = session.getCurrentUsePath();
        System.out.print((path != null ? path : "?") + "> ");
        System.out.flush();
    }

    public void close()
    {
        session.close();
    }

    private static final class ConsoleListener implements SessionListener
    {
        @Override
        public void onConnectionEstablished()
        {
            System.out.println("Connected to debug server");
        }

        @Override
        public void onConnectionLost()
        {
            System.out.println("Connection lost, reconnecting...");
        }

        @Override
        public void onConnectionFailure(Exception cause)
        {
            System.out.println("Connection failed: " + cause.getMessage());
        }
    }

    public static void main(String[] args)
    {
        String url = DEFAULT_URL;
        String user = null;
        String password = "";
        Duration timeout = DEFAULT_TIMEOUT;

        // Parse arguments
        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-u", "--user" ->
                {
                    if (i + 1 < args.length)
                    {
                        user = args[++i];
                    }
                }
                case "-p", "--password" ->
                {
                    if (i + 1 < args.length)
                    {
                        password = args[++i];
                    }
                }
                case "-t", "--timeout" ->
                {
                    if (i + 1 < args.length)
                    {
                        try
                        {
                            timeout = Duration.ofMillis(Long.parseLong(args[++i]));
                        }
                        catch (NumberFormatException e)
                        {
                            System.err.println("Invalid timeout");
                            System.exit(1);
                        }
                    }
                }
                case "--help" ->
                {
                    System.out.println("Usage: demo-console [options] [url]");
                    System.out.println("Options:");
                    System.out.println("  -u, --user <name>        User name for basic authentication");
                    System.out.println("  -p, --password <secret>  Password for basic authentication");
                    System.out.println("  -t, --timeout <ms>       Request timeout (default: 10000)");
                    System.exit(0);
                }
                default -> url = args[i];
            }
        }

        Optional<Credentials> credentials = user != null
                ? Optional.of(new Credentials(user, password))
                : Optional.empty();

        DebugConsole console;
        try
        {
            console = new DebugConsole(url, credentials, timeout);
        }
        catch (IllegalArgumentException | IllegalStateException e)
        {
            System.err.println("Invalid server address: " + e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("Connecting to " + url + " (type ':help' for commands)");
        console.runCommandLoop();
        console.close();
    }
}
