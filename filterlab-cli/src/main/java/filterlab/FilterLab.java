/*-
 * #%L
 * This file is part of FilterLab.
 * %%
 * Copyright (C) 2024 - 2026 FilterLab developers
 * %%
 * FilterLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * FilterLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with FilterLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package filterlab;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import filterlab.logging.LogManager;
import filterlab.logging.LogManager.LogLevel;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main FilterLab launcher.
 */
@Command(name = "filterlab", subcommands = {HelpCommand.class, ApplyCommand.class, ListCommand.class},
	description = "Apply pixel filters to images.",
	footer = {"", "Copyright(c) FilterLab developers (2024-2026)"},
	mixinStandardHelpOptions = true, versionProvider = FilterLab.VersionProvider.class)
public class FilterLab {

	private static final Logger logger = LoggerFactory.getLogger(FilterLab.class);

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel = LogLevel.INFO;

	@Option(names = {"--log-file"}, paramLabel = "file", description = "Also write log messages to the specified file.")
	private File logFile;

	/**
	 * Main method to launch FilterLab from the command line.
	 *
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0)
			logger.warn("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}

	/**
	 * Parse the arguments and run the requested subcommand.
	 * @param args
	 * @return the exit code; 0 if the command succeeded
	 */
	static int run(String... args) {
		FilterLab filterLab = new FilterLab();
		CommandLine cmd = createCommandLine(filterLab);
		ParseResult pr;
		try {
			pr = cmd.parseArgs(args);
		} catch (Exception e) {
			logger.error("An error has occurred, please type -h to display help message.\n" + e.getLocalizedMessage());
			return 1;
		}

		// Catch -h/--help and -V/--version
		if (cmd.isUsageHelpRequested()) {
			cmd.usage(cmd.getOut());
			return 0;
		} else if (cmd.isVersionHelpRequested()) {
			cmd.printVersionHelp(cmd.getOut());
			return 0;
		}

		if (filterLab.logLevel != null)
			LogManager.setRootLogLevel(filterLab.logLevel);
		if (filterLab.logFile != null)
			LogManager.logToFile(filterLab.logFile);

		if (!pr.hasSubcommand()) {
			cmd.usage(cmd.getOut());
			return 0;
		}
		return cmd.execute(args);
	}

	static CommandLine createCommandLine(FilterLab filterLab) {
		CommandLine cmd = new CommandLine(filterLab);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		return cmd;
	}


	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = FilterLab.class.getPackage().getImplementationVersion();
			if (version == null)
				return new String[] {"Unknown FilterLab version!"};
			return new String[] {"FilterLab v" + version};
		}

	}

}
