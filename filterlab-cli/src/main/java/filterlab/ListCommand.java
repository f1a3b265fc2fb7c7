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

import java.util.concurrent.Callable;

import filterlab.lib.filters.PixelFilters;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Print the names of the available filters.
 */
@Command(name = "list", description = "List the names of the available filters.")
class ListCommand implements Callable<Integer> {

	@Spec
	private CommandSpec spec;

	@Option(names = {"-j", "--json"}, description = "Also print the default JSON representation of each filter.")
	private boolean json;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Override
	public Integer call() {
		var out = spec.commandLine().getOut();
		for (var name : PixelFilters.getNames()) {
			if (json)
				out.println(name + "\t" + PixelFilters.toJson(PixelFilters.create(name)));
			else
				out.println(name);
		}
		out.flush();
		return 0;
	}

}
