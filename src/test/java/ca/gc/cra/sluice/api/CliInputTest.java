package ca.gc.cra.sluice.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"in=a", "--SLOW", "-v", "out=b", " "});

    assertArrayEquals(new String[] {"in=a", "out=b"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--slow"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}
