package com.acme.homelander.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CommandCatalogTest {

    @Test
    @DisplayName("all - should catalogue every command type exactly once")
    void testEveryCommandCatalogued() {
        Class<?>[] permitted = Command.class.getPermittedSubclasses();

        assertThat(permitted)
                .allSatisfy(type -> assertThat(CommandCatalog.all().containsValue(type))
                        .as(type.getSimpleName())
                        .isTrue());
        assertThat(CommandCatalog.all()).hasSize(permitted.length).hasSize(69);
    }

    @Test
    @DisplayName("all - should namespace every command name")
    void testNamespaced() {
        assertThat(CommandCatalog.all().keySet())
                .allSatisfy(name -> assertThat(name).startsWith("action.devices.commands."));
    }

    @Test
    @DisplayName("standard dispatcher - should handle every catalogued command")
    void testEveryCommandHandled() {
        CommandDispatcher dispatcher = CommandDispatcher.standard();

        assertThat(CommandCatalog.all().values()).allSatisfy(type -> assertThat(dispatcher.handles(type))
                .as(type.getSimpleName())
                .isTrue());
    }

    @Test
    @DisplayName("typeOf / nameOf - should resolve both ways")
    void testLookup() {
        assertThat(CommandCatalog.typeOf("action.devices.commands.OnOff")).contains(Command.OnOff.class);
        assertThat(CommandCatalog.typeOf("action.devices.commands.mute")).contains(Command.Mute.class);
        assertThat(CommandCatalog.typeOf("action.devices.commands.Teleport")).isEmpty();
        assertThat(CommandCatalog.nameOf(new Command.LockUnlock(true, null)))
                .isEqualTo("action.devices.commands.LockUnlock");
    }
}
