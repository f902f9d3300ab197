package org.maptracker.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.maptracker.merge.json.JsonUtils;

/**
 * Base for the parameters of the merge, stitch and bounds tools.
 * Subclasses are expected to be nested in the tool class they configure so that
 * the usage note can name that tool.
 *
 * Parsing never exits the JVM.
 * Unparseable arguments surface as an {@link IllegalArgumentException} that carries the usage note,
 * leaving the exit status to {@link org.maptracker.client.ClientRunner}.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Print the usage note for this tool and stop",
            help = true)
    public transient boolean help;

    /**
     * Populates this instance from a tool's command line.
     *
     * @return false if --help was given (the usage note has then been printed), otherwise true.
     *
     * @throws IllegalArgumentException
     *   if the arguments cannot be parsed or a required option is missing.
     */
    public boolean parse(final String[] args)
            throws IllegalArgumentException {

        final JCommander jCommander = buildCommander();
        try {
            jCommander.parse(args);
        } catch (final ParameterException e) {
            throw new IllegalArgumentException(e.getMessage() + "\n\n" + getUsage(jCommander), e);
        }

        if (help) {
            JCommander.getConsole().println(getUsage(jCommander));
        }

        return ! help;
    }

    public String getUsage() {
        return getUsage(buildCommander());
    }

    /**
     * @return the tool class these parameters are nested in, or the parameters class itself when not nested.
     */
    public Class<?> getToolClass() {
        final Class<?> enclosingClass = getClass().getEnclosingClass();
        return enclosingClass == null ? getClass() : enclosingClass;
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private JCommander buildCommander() {
        final JCommander jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp maptracker-client.jar " + getToolClass().getName());
        return jCommander;
    }

    private static String getUsage(final JCommander jCommander) {
        final StringBuilder usage = new StringBuilder();
        jCommander.usage(usage);
        return usage.toString();
    }

}
