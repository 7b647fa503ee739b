package com.tyron.syntaxkit.core.service;

import com.tyron.syntaxkit.api.path.PathResolver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;

public class DefaultServiceContainerTest {

    public interface Greeter {
        String greet();
    }

    public static class EnglishGreeter implements Greeter {
        @Override
        public String greet() {
            return "hello";
        }
    }

    public static class FrenchGreeter implements Greeter {
        @Override
        public String greet() {
            return "bonjour";
        }
    }

    public static class NeedsArgument implements Greeter {
        public NeedsArgument(String greeting) {
        }

        @Override
        public String greet() {
            return "";
        }
    }

    public static class Failing implements Greeter {
        public Failing() {
            throw new IllegalStateException("cannot start");
        }

        @Override
        public String greet() {
            return "";
        }
    }

    public static class SelfReferencing implements Greeter {
        static DefaultServiceContainer container;

        public SelfReferencing() {
            container.getService(Greeter.class);
        }

        @Override
        public String greet() {
            return "";
        }
    }

    @Test
    public void servicesAreSingletons() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        container.registerBinding(Greeter.class, EnglishGreeter.class);

        Greeter first = container.getService(Greeter.class);

        Assertions.assertSame(first, container.getService(Greeter.class));
        Assertions.assertEquals("hello", first.greet());
    }

    @Test
    public void bindingIfAbsentKeepsExistingBinding() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        container.registerBinding(Greeter.class, FrenchGreeter.class);
        container.registerBindingIfAbsent(Greeter.class, EnglishGreeter.class);

        Assertions.assertEquals("bonjour", container.getService(Greeter.class).greet());
    }

    @Test
    public void cannotRebindInstantiatedService() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        container.registerBinding(Greeter.class, EnglishGreeter.class);
        container.getService(Greeter.class);

        Assertions.assertThrows(IllegalStateException.class,
                () -> container.registerBinding(Greeter.class, FrenchGreeter.class));
    }

    @Test
    public void registeredInstanceWins() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        Greeter custom = () -> "hi";
        container.registerInstance(Greeter.class, custom);

        Assertions.assertSame(custom, container.getService(Greeter.class));
    }

    @Test
    public void unboundInterfaceFails() {
        DefaultServiceContainer container = new DefaultServiceContainer();

        ServiceInstantiationException e = Assertions.assertThrows(ServiceInstantiationException.class,
                () -> container.getService(Greeter.class));
        Assertions.assertEquals(Greeter.class, e.getServiceClass());
        Assertions.assertEquals("No implementation bound to Greeter", e.getMessage());
    }

    @Test
    public void unboundSyntaxKitServiceMentionsDefaults() {
        DefaultServiceContainer container = new DefaultServiceContainer();

        ServiceInstantiationException e = Assertions.assertThrows(ServiceInstantiationException.class,
                () -> container.getService(PathResolver.class));
        assertThat(e).hasMessageThat().startsWith("No implementation bound to PathResolver");
        assertThat(e).hasMessageThat().contains("ServiceAccessBootstrap");
    }

    @Test
    public void selfDependencyFailsInsteadOfRecursing() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        container.registerBinding(Greeter.class, SelfReferencing.class);
        SelfReferencing.container = container;

        ServiceInstantiationException e = Assertions.assertThrows(ServiceInstantiationException.class,
                () -> container.getService(Greeter.class));
        Assertions.assertEquals("Greeter depends on itself while being created", e.getMessage());
        // nothing half-built is cached
        container.disposeAll();
        container.registerBinding(Greeter.class, EnglishGreeter.class);
        Assertions.assertEquals("hello", container.getService(Greeter.class).greet());
    }

    @Test
    public void constructorProblemsAreReported() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        container.registerBinding(Greeter.class, NeedsArgument.class);

        ServiceInstantiationException e = Assertions.assertThrows(ServiceInstantiationException.class,
                () -> container.getService(Greeter.class));
        Assertions.assertTrue(e.getMessage().contains("no-arg constructor"));

        DefaultServiceContainer failing = new DefaultServiceContainer();
        failing.registerBinding(Greeter.class, Failing.class);
        ServiceInstantiationException thrown = Assertions.assertThrows(ServiceInstantiationException.class,
                () -> failing.getService(Greeter.class));
        Assertions.assertInstanceOf(IllegalStateException.class, thrown.getCause());
        Assertions.assertEquals(Greeter.class, thrown.getServiceClass());
    }

    @Test
    public void lateExtensionRefreshesTheList() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        container.registerExtension(Greeter.class, EnglishGreeter.class);
        List<Greeter> before = container.getExtensions(Greeter.class);

        container.registerExtension(Greeter.class, FrenchGreeter.class);

        Assertions.assertEquals(1, before.size());
        Assertions.assertEquals(List.of("hello", "bonjour"),
                container.getExtensions(Greeter.class).stream().map(Greeter::greet).toList());
    }

    @Test
    public void extensionsAreDeduplicatedAndOrdered() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        container.registerExtension(Greeter.class, FrenchGreeter.class);
        container.registerExtension(Greeter.class, EnglishGreeter.class);
        container.registerExtension(Greeter.class, FrenchGreeter.class);

        List<Greeter> greeters = container.getExtensions(Greeter.class);

        Assertions.assertEquals(List.of("bonjour", "hello"), greeters.stream().map(Greeter::greet).toList());
        Assertions.assertSame(greeters, container.getExtensions(Greeter.class));
        Assertions.assertTrue(container.getExtensions(Runnable.class).isEmpty());
    }

    @Test
    public void disposeForgetsEverything() {
        DefaultServiceContainer container = new DefaultServiceContainer();
        container.registerBinding(Greeter.class, EnglishGreeter.class);
        container.registerExtension(Greeter.class, EnglishGreeter.class);
        container.getService(Greeter.class);

        container.disposeAll();

        Assertions.assertThrows(ServiceInstantiationException.class, () -> container.getService(Greeter.class));
        Assertions.assertTrue(container.getExtensions(Greeter.class).isEmpty());
    }
}
