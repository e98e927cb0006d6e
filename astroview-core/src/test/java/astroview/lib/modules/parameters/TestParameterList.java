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

package astroview.lib.modules.parameters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestParameterList {

	private static ParameterList createParams() {
		return new ParameterList()
				.addTitleParameter("Enhancement")
				.addDoubleParameter("sharpen_strength", "Sharpen strength", 2.0, null, 0, 5, "Weight of the unsharp mask")
				.addIntParameter("filter_size", "Filter size", 3, "px", 1, 15, null)
				.addEmptyParameter("Some text")
				.addStringParameter("kernel", "Kernel", "0,0,0; 0,1,0; 0,0,0", null);
	}

	@Test
	public void test_keys() {
		var params = createParams();
		assertEquals(List.of("title1", "sharpen_strength", "filter_size", "empty1", "kernel"), List.copyOf(params.getParameters().keySet()));
		assertEquals(List.of("sharpen_strength", "filter_size", "kernel"), List.copyOf(params.getKeyValueParameters().keySet()));
		assertTrue(params.containsKey("kernel"));
		assertFalse(params.containsKey("sigma"));
		assertNull(params.getParameter("sigma"));
		assertInstanceOf(EmptyParameter.class, params.getParameter("title1"));
	}

	@Test
	public void test_values() {
		var params = createParams();
		assertEquals(2.0, params.getDoubleParameterValue("sharpen_strength"));
		assertEquals(3, params.getIntParameterValue("filter_size"));
		assertEquals("0,0,0; 0,1,0; 0,0,0", params.getStringParameterValue("kernel"));

		assertThrows(IllegalArgumentException.class, () -> params.getDoubleParameterValue("filter_size"));
		assertThrows(IllegalArgumentException.class, () -> params.getIntParameterValue("missing"));
		assertThrows(IllegalArgumentException.class, () -> params.getStringParameterValue("title1"));
	}

	@Test
	public void test_bounds() {
		var params = createParams();
		assertTrue(params.setStringValue("sharpen_strength", "4.5", Locale.US));
		assertEquals(4.5, params.getDoubleParameterValue("sharpen_strength"));
		assertFalse(params.setStringValue("sharpen_strength", "6", Locale.US));
		assertFalse(params.setStringValue("sharpen_strength", "abc", Locale.US));
		assertEquals(4.5, params.getDoubleParameterValue("sharpen_strength"));

		var p = (DoubleParameter)params.getParameter("sharpen_strength");
		assertTrue(p.setDoubleValueWithBoundsCheck(100));
		assertEquals(5.0, p.getValue());
		p.resetValue();
		assertEquals(2.0, p.getValueOrDefault());

		var size = (IntParameter)params.getParameter("filter_size");
		assertEquals("px", size.getUnit());
		assertTrue(size.hasLowerBound() && size.hasUpperBound());
		assertTrue(size.setDoubleValue(6.6));
		assertEquals(7, size.getValue());

		assertThrows(IllegalArgumentException.class, () -> new ParameterList().addDoubleParameter("x", "X", 1, null, 2, 1, null));
	}

	@Test
	public void test_locale() {
		var params = createParams();
		assertTrue(params.setStringValue("sharpen_strength", "1,5", Locale.GERMANY));
		assertEquals(1.5, params.getDoubleParameterValue("sharpen_strength"));
	}

	@Test
	public void test_update() {
		var params = createParams();
		int n = ParameterList.updateParameterList(params, Map.of("filter_size", "5", "kernel", "1 1 1 1 1 1 1 1 1", "missing", "1"), Locale.US);
		assertEquals(2, n);
		assertEquals(5, params.getIntParameterValue("filter_size"));
		assertEquals("1 1 1 1 1 1 1 1 1", params.getStringParameterValue("kernel"));
	}

	@Test
	public void test_duplicate() {
		var params = createParams();
		params.setStringValue("filter_size", "9", Locale.US);
		var copy = params.duplicate();
		assertEquals(params.getKeyValueParameters(), copy.getKeyValueParameters());
		copy.setStringValue("filter_size", "11", Locale.US);
		assertEquals(9, params.getIntParameterValue("filter_size"));
		assertEquals(11, copy.getIntParameterValue("filter_size"));
		assertEquals("Weight of the unsharp mask", copy.getParameter("sharpen_strength").getHelpText());
	}

}
