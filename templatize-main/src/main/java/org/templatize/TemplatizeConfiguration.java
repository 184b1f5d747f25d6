package org.templatize;

import org.templatize.syntax.CSharpInterpolatedSyntax;
import org.templatize.syntax.TemplateSyntax;
import org.templatize.syntax.TemplateSyntaxes;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine settings. Read from system properties ({@code -Dtemplatize.syntax=java}) or built in code.
 */
public final class TemplatizeConfiguration {

    public static final String SYNTAX = "templatize.syntax";
    public static final String CANCELLATION_CHECK_INTERVAL = "templatize.cancellation.checkInterval";
    public static final String PARENTHESIZE_ALL = "templatize.parenthesize.all";

    public static final int DEFAULT_CANCELLATION_CHECK_INTERVAL = 64;

    private final TemplateSyntax syntax;
    private final int cancellationCheckInterval;
    private final boolean parenthesizeAll;

    private TemplatizeConfiguration(Builder builder) {
        this.syntax = builder.syntax;
        this.cancellationCheckInterval = builder.cancellationCheckInterval;
        this.parenthesizeAll = builder.parenthesizeAll;
    }

    public static TemplatizeConfiguration defaults() {
        return builder().build();
    }

    public static TemplatizeConfiguration fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads system properties, using {@code defaultSyntax} when {@value #SYNTAX} is not set.
     */
    public static TemplatizeConfiguration fromSystemProperties(TemplateSyntax defaultSyntax) {
        return fromProperties(System.getProperties(), defaultSyntax);
    }

    public static TemplatizeConfiguration fromProperties(Properties properties) {
        return fromProperties(properties, CSharpInterpolatedSyntax.INSTANCE);
    }

    public static TemplatizeConfiguration fromProperties(Properties properties, TemplateSyntax defaultSyntax) {
        Builder builder = builder().syntax(defaultSyntax);

        String syntaxName = properties.getProperty(SYNTAX);
        if (syntaxName != null) {
            try {
                builder.syntax(TemplateSyntaxes.forName(syntaxName));
            } catch (IllegalArgumentException e) {
                throw new TemplatizeConfigurationException(SYNTAX, syntaxName, e);
            }
        }

        String interval = properties.getProperty(CANCELLATION_CHECK_INTERVAL);
        if (interval != null) {
            int parsed;
            try {
                parsed = Integer.parseInt(interval.trim());
            } catch (NumberFormatException e) {
                throw new TemplatizeConfigurationException(CANCELLATION_CHECK_INTERVAL, interval, e);
            }
            builder.cancellationCheckInterval(parsed);
        }

        String parenthesize = properties.getProperty(PARENTHESIZE_ALL);
        if (parenthesize != null) {
            String normalized = parenthesize.trim().toLowerCase(Locale.ROOT);
            if (!normalized.equals("true") && !normalized.equals("false")) {
                throw new TemplatizeConfigurationException(PARENTHESIZE_ALL, parenthesize, "expected true or false");
            }
            builder.parenthesizeAll(Boolean.parseBoolean(normalized));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TemplateSyntax getSyntax() {
        return syntax;
    }

    public int getCancellationCheckInterval() {
        return cancellationCheckInterval;
    }

    public boolean isParenthesizeAll() {
        return parenthesizeAll;
    }

    @Override
    public String toString() {
        return "TemplatizeConfiguration{" +
               "syntax=" + syntax.name() +
               ", cancellationCheckInterval=" + cancellationCheckInterval +
               ", parenthesizeAll=" + parenthesizeAll +
               '}';
    }

    public static final class Builder {

        private TemplateSyntax syntax = CSharpInterpolatedSyntax.INSTANCE;
        private int cancellationCheckInterval = DEFAULT_CANCELLATION_CHECK_INTERVAL;
        private boolean parenthesizeAll;

        private Builder() {
        }

        public Builder syntax(TemplateSyntax syntax) {
            this.syntax = Objects.requireNonNull(syntax, "syntax");
            return this;
        }

        public Builder cancellationCheckInterval(int cancellationCheckInterval) {
            if (cancellationCheckInterval < 1) {
                throw new TemplatizeConfigurationException(CANCELLATION_CHECK_INTERVAL,
                        String.valueOf(cancellationCheckInterval), "must be positive");
            }
            this.cancellationCheckInterval = cancellationCheckInterval;
            return this;
        }

        public Builder parenthesizeAll(boolean parenthesizeAll) {
            this.parenthesizeAll = parenthesizeAll;
            return this;
        }

        public TemplatizeConfiguration build() {
            return new TemplatizeConfiguration(this);
        }
    }
}
