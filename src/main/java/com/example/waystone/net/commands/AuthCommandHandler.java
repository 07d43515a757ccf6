package com.example.waystone.net.commands;

import com.example.waystone.model.UserAccount;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.CommandDefinition;
import com.example.waystone.net.CommandDefinition.Category;
import com.example.waystone.net.Session;
import com.example.waystone.net.SessionState;
import com.example.waystone.persistence.UserDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Handles account commands (register, login, logout, quit).
 */
public class AuthCommandHandler implements CommandHandler {
    private static final Logger logger = LoggerFactory.getLogger(AuthCommandHandler.class);

    static final Pattern USERNAME_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]{2,19}$");
    static final Pattern EMAIL_PATTERN = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    static final int MIN_PASSWORD_LENGTH = 6;

    private static final List<CommandDefinition> COMMANDS = List.of(
            CommandDefinition.builder("register", Category.AUTHENTICATION)
                    .usage("register <username> <password> <email>")
                    .description("Create a new account")
                    .minArgs(3)
                    .build(),
            CommandDefinition.builder("login", Category.AUTHENTICATION)
                    .usage("login <username> [password]")
                    .description("Log into your account")
                    .minArgs(1)
                    .build(),
            CommandDefinition.builder("logout", Category.AUTHENTICATION)
                    .description("Log out of your account")
                    .build(),
            CommandDefinition.builder("quit", Category.AUTHENTICATION)
                    .aliases("exit")
                    .description("Disconnect from the server")
                    .build());

    @Override
    public List<CommandDefinition> getCommands() {
        return COMMANDS;
    }

    @Override
    public void handle(CommandContext ctx) throws Exception {
        switch (ctx.getCommandName()) {
            case "register": handleRegister(ctx); break;
            case "login": handleLogin(ctx); break;
            case "logout": handleLogout(ctx); break;
            case "quit": handleQuit(ctx); break;
            default: throw new IllegalArgumentException("Unsupported command " + ctx.getCommandName());
        }
    }

    private void handleRegister(CommandContext ctx) {
        Session session = ctx.getSession();
        if (session.getUserId() != null) {
            ctx.send(Ansi.colorize("You are already logged in. Use 'logout' first.", "YELLOW"));
            return;
        }
        String username = ctx.getArg(0);
        String password = ctx.getArg(1);
        String email = ctx.getArg(2);
        beginAuthentication(session);

        if (!USERNAME_PATTERN.matcher(username).matches()) {
            ctx.send(Ansi.colorize("Invalid username. Must be 3-20 characters, start with a letter, "
                    + "and contain only letters, numbers, and underscores.", "RED"));
            return;
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            ctx.send(Ansi.colorize("Password must be at least " + MIN_PASSWORD_LENGTH + " characters long.", "RED"));
            return;
        }
        if (!EMAIL_PATTERN.matcher(email).matches()) {
            ctx.send(Ansi.colorize("Invalid email address.", "RED"));
            return;
        }

        UserDAO.RegistrationResult result = ctx.getEngine().getUserDao().register(username, email, password.toCharArray());
        switch (result) {
            case USERNAME_TAKEN:
                ctx.send(Ansi.colorize("Username '" + username + "' is already taken.", "RED"));
                return;
            case EMAIL_TAKEN:
                ctx.send(Ansi.colorize("Email address is already registered.", "RED"));
                return;
            default:
                break;
        }
        logger.info("Account {} registered from {}", username, ctx.getConnection().getRemoteAddress());
        ctx.send(Ansi.colorize("\nAccount created successfully! Welcome, " + username + "!", "GREEN"));
        ctx.send(Ansi.colorize("You can now log in with: ", "CYAN")
                + Ansi.colorize("login " + username + " <password>", "YELLOW"));
    }

    private void handleLogin(CommandContext ctx) throws Exception {
        Session session = ctx.getSession();
        if (session.getUserId() != null) {
            ctx.send(Ansi.colorize("You are already logged in. Use 'logout' first.", "YELLOW"));
            return;
        }
        String username = ctx.getArg(0);
        beginAuthentication(session);

        String password = ctx.getArg(1);
        if (password == null) {
            ctx.getConnection().send("Password: ");
            password = ctx.getConnection().readPassword();
        }

        Optional<UserAccount> user = ctx.getEngine().getUserDao().authenticate(username, password.toCharArray());
        if (user.isEmpty()) {
            logger.info("Failed login for '{}' from {}", username, ctx.getConnection().getRemoteAddress());
            ctx.send(Ansi.colorize("Invalid username or password.", "RED"));
            return;
        }

        UserAccount account = user.get();
        Optional<Session> other = ctx.getEngine().getSessionManager().getSessionByUser(account.getId());
        if (other.isPresent() && other.get() != session) {
            ctx.send(Ansi.colorize("That account is already logged in from another connection.", "RED"));
            return;
        }

        session.setUser(account.getId());
        logger.info("User {} logged in on session {}", username, session.getId());
        ctx.send(Ansi.colorize("\nWelcome back, " + account.getUsername() + "!", "GREEN"));
        ctx.send("");
        ctx.send("Type " + Ansi.colorize("characters", "YELLOW") + " to see your characters, or "
                + Ansi.colorize("create <name>", "YELLOW") + " to create a new one.");
    }

    private void handleLogout(CommandContext ctx) {
        Session session = ctx.getSession();
        if (session.getUserId() == null) {
            ctx.send(Ansi.colorize("You are not logged in.", "YELLOW"));
            return;
        }
        String username = ctx.getEngine().getUserDao().findById(session.getUserId())
                .map(UserAccount::getUsername)
                .orElse("player");

        ctx.getEngine().leaveWorld(session);
        session.clearIdentity();
        session.setState(SessionState.CONNECTED);

        logger.info("User {} logged out of session {}", username, session.getId());
        ctx.send(Ansi.colorize("\nGoodbye, " + username + "!", "CYAN"));
        ctx.send("Type " + Ansi.colorize("login <username> <password>", "YELLOW") + " to log back in.");
    }

    private void handleQuit(CommandContext ctx) {
        ctx.send(Ansi.colorize("\nFarewell, traveler. May the roads rise to meet you.", "CYAN"));
        logger.info("Session {} quit", ctx.getSession().getId());
        ctx.getEngine().disconnect(ctx.getSession());
    }

    private static void beginAuthentication(Session session) {
        if (session.getState() == SessionState.CONNECTED) {
            session.setState(SessionState.AUTHENTICATING);
        }
    }
}
