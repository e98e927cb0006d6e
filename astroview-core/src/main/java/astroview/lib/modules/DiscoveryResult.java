/*-
 * #%L
 * This file is part of AstroView.
 * %%
 * Copyright (C) 2025 AstroView developers
 * %%
 * AstroView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * AstroView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with AstroView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package astroview.lib.modules;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of attempting to obtain a {@link ProcessingUnit} from one module source.
 * <p>
 * A source that fails to provide a unit is recorded here rather than causing discovery to fail,
 * so that one broken module cannot prevent the others from loading.
 */
public final class DiscoveryResult {

	private final String source;
	private final ProcessingUnit unit;
	private final ModuleDiscoveryException exception;

	private DiscoveryResult(String source, ProcessingUnit unit, ModuleDiscoveryException exception) {
		this.source = Objects.requireNonNull(source);
		this.unit = unit;
		this.exception = exception;
	}

	/**
	 * Create a successful result.
	 * @param source
	 * @param unit
	 * @return
	 */
	public static DiscoveryResult success(String source, ProcessingUnit unit) {
		return new DiscoveryResult(source, Objects.requireNonNull(unit), null);
	}

	/**
	 * Create a failed result.
	 * @param source
	 * @param exception
	 * @return
	 */
	public static DiscoveryResult failure(String source, ModuleDiscoveryException exception) {
		return new DiscoveryResult(source, null, Objects.requireNonNull(exception));
	}

	/**
	 * Description of the module source, e.g. a directory name.
	 * @return
	 */
	public String getSource() {
		return source;
	}

	/**
	 * Returns true if a unit was obtained from the source.
	 * @return
	 */
	public boolean isSuccess() {
		return unit != null;
	}

	/**
	 * The unit, if discovery succeeded.
	 * @return
	 */
	public Optional<ProcessingUnit> getUnit() {
		return Optional.ofNullable(unit);
	}

	/**
	 * The reason for failure, if discovery failed.
	 * @return
	 */
	public Optional<ModuleDiscoveryException> getException() {
		return Optional.ofNullable(exception);
	}

	@Override
	public String toString() {
		if (isSuccess())
			return "DiscoveryResult [" + source + ": " + unit.getClass().getName() + "]";
		return "DiscoveryResult [" + source + ": failed - " + exception.getLocalizedMessage() + "]";
	}

}
