package com.github.fsmgraph;

import static org.junit.Assert.assertEquals;

import java.util.Locale;

import org.junit.Test;

public class StyleClassTest {

  @Test
  public void testCssNameIgnoresDefaultLocale() {
    final Locale original = Locale.getDefault();
    try {
      Locale.setDefault(new Locale("tr", "TR"));
      assertEquals("inactive", StyleClass.INACTIVE.cssName());
      assertEquals("active", StyleClass.ACTIVE.cssName());
    } finally {
      Locale.setDefault(original);
    }
  }
}
