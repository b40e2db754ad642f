package org.metricshub.exprc;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Exprc
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.Objects;

/**
 * Outcome of {@link ExprCompiler#compile(String)}: either the output of every
 * phase, or the message of the first error met.
 */
public final class CompileResult {

	private final PhaseResults phases;
	private final String error;

	private CompileResult(PhaseResults phases, String error) {
		this.phases = phases;
		this.error = error;
	}

	static CompileResult success(PhaseResults phases) {
		return new CompileResult(Objects.requireNonNull(phases, "phases"), null);
	}

	static CompileResult failure(String error) {
		return new CompileResult(null, Objects.requireNonNull(error, "error"));
	}

	public boolean isSuccess() {
		return phases != null;
	}

	/**
	 * @return the phase outputs
	 * @throws IllegalStateException if the compilation failed
	 */
	public PhaseResults getPhases() {
		if (phases == null) {
			throw new IllegalStateException("Compilation failed: " + error);
		}
		return phases;
	}

	/**
	 * @return the error message, or {@code null} on success
	 */
	public String getError() {
		return error;
	}

	@Override
	public String toString() {
		return isSuccess() ? "CompileResult" + phases : "CompileResult{error=" + error + "}";
	}
}
