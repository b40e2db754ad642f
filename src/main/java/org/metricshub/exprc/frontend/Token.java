package org.metricshub.exprc.frontend;

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
 * A token produced by {@link ExprLexer}. Tokens do not remember where they
 * were found in the source.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;

	public Token(TokenKind kind, String text) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = Objects.requireNonNull(text, "text");
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	/**
	 * @param operator operator text such as {@code "+"} or {@code ")"}
	 * @return {@code true} if this token is that operator
	 */
	public boolean isOperator(String operator) {
		return kind == TokenKind.OPERATOR && text.equals(operator);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return kind == other.kind && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text);
	}

	@Override
	public String toString() {
		return kind.getLabel() + " '" + text + "'";
	}
}
