package works.propkit;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;
import works.propkit.exceptions.AttributeException;
import works.propkit.exceptions.ConfigurationException;
import works.propkit.exceptions.FieldInjectionException;
import works.propkit.exceptions.NoSuchAttributeException;
import works.propkit.exceptions.ReadOnlyPropertyException;
import works.propkit.exceptions.UsageException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.propkit.logging.MdcKeys.MANAGED_CLASS;

class ManagedClassTest {
	record Change(String listener, String slot, Object oldValue, Object newValue) { }

	List<Change> changes;
	ManagedClass car;

	@BeforeEach
	void defineCar() {
		changes = new ArrayList<>();
		car = ManagedClass.define("Car", ns -> {
			ns.initializer(FieldCopier.initializer());
			try (var props = PropertyBuilder.open(ns, "props")) {
				props.prop("brand", self -> { throw new IllegalStateException("Car has no brand"); }, FieldOptions.builder()
					.readOnly(true)
					.build());
				props.prop("speed", self -> 0, FieldOptions.builder()
					.listener("onSpeed")
					.build());
				props.prop("on", self -> false, FieldOptions.builder()
					.listener("onPower")
					.build());
			}
			ns.listener("onSpeed", (self, slot, oldValue, newValue) -> changes.add(new Change("onSpeed", slot, oldValue, newValue)));
			ns.listener("onPower", (self, slot, oldValue, newValue) -> changes.add(new Change("onPower", slot, oldValue, newValue)));
		});
	}

	@Test
	void carScenario() {
		ManagedObject ford = car.newInstance(Map.of("brand", "Ford"));
		assertEquals("Ford", ford.get("brand"));
		assertEquals(0, ford.get("speed"));
		assertEquals(false, ford.get("on"));

		ford.set("speed", 50);
		assertEquals(List.of(new Change("onSpeed", "_speed", null, 50)), changes);

		ford.set("on", true);
		assertEquals(new Change("onPower", "_on", null, true), changes.get(1));

		ford.set("speed", 50);
		assertEquals(2, changes.size());

		FieldInjectionException e = assertThrows(FieldInjectionException.class, () -> ford.set("model", 2020));
		assertEquals("model", e.attributeName());
		assertEquals("Car", e.className());
		assertTrue(e.getMessage().contains("Car.model"));
	}

	@Test
	void readOnlyProperty_cannotBeSet() {
		ManagedObject ford = car.newInstance(Map.of("brand", "Ford"));
		assertThrows(ReadOnlyPropertyException.class, () -> ford.set("brand", "Chevrolet"));
		assertEquals("Ford", ford.get("brand"));
	}

	@Test
	void unassignedReadOnlyProperty_usesDefault() {
		ManagedObject anonymous = car.newInstance();
		assertThrows(IllegalStateException.class, () -> anonymous.get("brand"));
	}

	@ParameterizedTest
	@ValueSource(strings = { "model", "year", "props", "__slots__", "dirty", "_dirty", "_args" })
	void undeclaredAttribute_cannotBeSet(String name) {
		ManagedObject ford = car.newInstance(Map.of("brand", "Ford"));
		assertThrows(FieldInjectionException.class, () -> ford.set(name, 1));
		assertThrows(NoSuchAttributeException.class, () -> ford.get(name));
	}

	@Test
	void undeclaredConstructorArgument_throws() {
		assertThrows(FieldInjectionException.class, () -> car.newInstance(Map.of("brand", "Ford", "model", "T")));
	}

	@Test
	void slotName_isWritableDirectly() {
		ManagedObject ford = car.newInstance(Map.of("brand", "Ford"));
		ford.set("_speed", 30);
		assertEquals(30, ford.get("speed"));
		assertEquals(30, ford.get("_speed"));
		assertEquals(List.of(), changes);
	}

	@Test
	void listener_seesNewValue() {
		List<Object> observed = new ArrayList<>();
		ManagedClass lamp = ManagedClass.define("Lamp", ns -> {
			try (var props = PropertyBuilder.open(ns, "props")) {
				props.prop("lit", self -> false, FieldOptions.builder().observed(true).build());
			}
			ns.listener("onPropertyChanged", (self, slot, oldValue, newValue) -> {
				observed.add(self.get("lit"));
				observed.add(oldValue);
			});
		});
		ManagedObject lamp1 = lamp.newInstance();
		lamp1.set("lit", true);
		lamp1.set("lit", false);
		assertEquals(Arrays.asList(true, null, false, true), observed);
	}

	@Test
	void listenerReceivesNullForUnassigned_notDefault() {
		ManagedObject ford = car.newInstance(Map.of("brand", "Ford"));
		ford.set("on", false);
		assertEquals(List.of(new Change("onPower", "_on", null, false)), changes);
	}

	@Test
	void identicalWrites_haveNoSideEffects() {
		ManagedClass counter = ManagedClass.define("Counter", ns -> {
			try (var props = PropertyBuilder.open(ns, "props", true)) {
				props.prop("count", self -> 0, FieldOptions.builder().listener("onCount").build());
			}
			ns.listener("onCount", (self, slot, oldValue, newValue) -> changes.add(new Change("onCount", slot, oldValue, newValue)));
		});
		ManagedObject c = counter.newInstance();
		c.set("count", 1);
		assertTrue(c.isDirty());
		c.markClean();
		for (int i = 0; i < 5; i++) {
			c.set("count", 1);
		}
		assertFalse(c.isDirty());
		assertEquals(1, changes.size());

		c.set("count", 2);
		assertTrue(c.isDirty());
		assertEquals(new Change("onCount", "_count", 1, 2), changes.get(1));
	}

	@Test
	void writingNullToUnassigned_isNoOp() {
		ManagedObject ford = car.newInstance(Map.of("brand", "Ford"));
		ford.set("speed", null);
		assertFalse(ford.storage().isAssigned("_speed"));
		assertEquals(0, ford.get("speed"));
		assertEquals(List.of(), changes);
	}

	@Test
	void defaults_areRecomputed() {
		int[] calls = { 0 };
		ManagedClass box = ManagedClass.define("Box", ns -> {
			try (var props = PropertyBuilder.open(ns, "props")) {
				props.prop("width", self -> 10);
				props.prop("area", self -> self.get("width", Integer.class) * self.get("width", Integer.class));
				props.prop("ticket", self -> ++calls[0]);
			}
		});
		ManagedObject b = box.newInstance();
		assertEquals(1, b.get("ticket"));
		assertEquals(2, b.get("ticket"));
		assertFalse(b.storage().isAssigned("_ticket"));

		assertEquals(100, b.get("area"));
		b.set("width", 3);
		assertEquals(9, b.get("area"));

		b.set("ticket", 42);
		assertEquals(42, b.get("ticket"));
		assertEquals(42, b.get("ticket"));
		assertEquals(2, calls[0]);
	}

	@Test
	void dirtyFlag_onlyForAutoDirtyProperties() {
		ManagedClass doc = ManagedClass.define("Document", ns -> {
			try (var props = PropertyBuilder.open(ns, "props")) {
				props.prop("title", self -> "", FieldOptions.builder().autoDirty(true).build());
				props.prop("views", self -> 0);
			}
		});
		ManagedObject d = doc.newInstance();
		assertFalse(d.isDirty());
		d.set("views", 1);
		assertFalse(d.isDirty());
		d.set("title", "Draft");
		assertTrue(d.isDirty());
		assertEquals(true, d.get("_dirty"));
		d.markClean();
		assertFalse(d.isDirty());
	}

	@Test
	void classWithoutDirtySlot_isNeverDirty() {
		ManagedObject ford = car.newInstance(Map.of("brand", "Ford"));
		ford.set("speed", 10);
		assertFalse(ford.isDirty());
		ford.markClean();
		assertFalse(ford.storage().layout().contains("_dirty"));
	}

	@Test
	void builderAlias_isNotAMember() {
		assertFalse(car.hasMember("props"));
		assertNull(car.property("props"));
		assertEquals(List.of("brand", "speed", "on"), List.copyOf(car.properties().keySet()));
		assertTrue(car.hasMember("onSpeed"));
	}

	@Test
	void storage_matchesLayoutExactly() {
		assertEquals(List.of("_brand", "_speed", "_on"), car.layout().slots());
		ManagedObject a = car.newInstance(Map.of("brand", "Ford"));
		ManagedObject b = car.newInstance(Map.of("brand", "Audi"));
		assertEquals(car.layout(), a.storage().layout());
		assertEquals(car.layout(), b.storage().layout());
	}

	@Test
	void instances_doNotShareState() {
		ManagedObject a = car.newInstance(Map.of("brand", "Ford"));
		ManagedObject b = car.newInstance(Map.of("brand", "Audi"));
		a.set("speed", 80);
		assertEquals(80, a.get("speed"));
		assertEquals(0, b.get("speed"));
	}

	@Test
	void readOnlyWithListener_failsBeforeAnyInstance() {
		assertThrows(ConfigurationException.class, () -> ManagedClass.define("Bad", ns -> {
			try (var props = PropertyBuilder.open(ns, "props")) {
				props.prop("serial", self -> 0, FieldOptions.builder().readOnly(true).listener("onSerial").build());
			}
			ns.listener("onSerial", (self, slot, oldValue, newValue) -> { });
		}));
	}

	@Test
	void undefinedListener_throws() {
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> ManagedClass.define("Bad", ns -> {
			try (var props = PropertyBuilder.open(ns, "props")) {
				props.prop("speed", self -> 0, FieldOptions.builder().listener("onSpeed").build());
			}
		}));
		assertTrue(e.getMessage().contains("onSpeed"));
	}

	@Test
	void unclosedBuilder_throws() {
		assertThrows(UsageException.class, () -> ManagedClass.define("Bad", ns -> {
			PropertyBuilder.open(ns, "props").prop("speed", self -> 0);
		}));
	}

	@Test
	void propertyWithoutSlot_throws() {
		assertThrows(ConfigurationException.class, () -> ManagedClass.define("Bad", ns -> {
			try (var props = PropertyBuilder.open(ns, "props")) {
				props.prop("speed", self -> 0);
			}
			ns.remove(ClassNamespace.STORAGE_LAYOUT);
		}));
	}

	@Test
	void checkedExceptionInBody_isWrapped() {
		IOException cause = new IOException("disk on fire");
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> ManagedClass.define("Bad", ns -> {
			throw cause;
		}));
		assertEquals(cause, e.getCause());
	}

	@Test
	void argumentsWithoutInitializer_throw() {
		ManagedClass plain = ManagedClass.define("Plain", ns -> {
			try (var props = PropertyBuilder.open(ns, "props")) {
				props.prop("size", self -> 1);
			}
		});
		assertEquals(1, plain.newInstance().get("size"));
		assertThrows(UsageException.class, () -> plain.newInstance(Map.of("size", 2)));
	}

	@Test
	void multipleBuilders_shareLayout() {
		ManagedClass shape = ManagedClass.define("Shape", ns -> {
			ns.declareSlots("_args");
			ns.initializer(FieldCopier.initializer(Set.of(), true));
			try (var geometry = PropertyBuilder.open(ns, "geometry")) {
				geometry.prop("width", self -> 1);
				geometry.prop("height", self -> 1);
			}
			try (var style = PropertyBuilder.open(ns, "style", true)) {
				style.prop("color", self -> "black");
			}
		});
		assertEquals(List.of("_args", "_width", "_height", "_dirty", "_color"), shape.layout().slots());

		Map<String, Object> arguments = new LinkedHashMap<>();
		arguments.put("self", null);
		arguments.put("width", 3);
		arguments.put("height", 4);
		ManagedObject s = shape.newInstance(arguments);
		assertEquals(List.of(3, 4), s.get("_args"));
		assertFalse(s.isDirty());
	}

	@Test
	void attributeExceptions_areConfigurationExceptions() {
		ManagedObject ford = car.newInstance(Map.of("brand", "Ford"));
		AttributeException e = assertThrows(AttributeException.class, () -> ford.set("brand", "Audi"));
		assertInstanceOf(ConfigurationException.class, e);
		assertEquals("brand", e.attributeName());
	}

	@Test
	void nestedDefine_restoresOuterClassInMDC() {
		List<String> seen = new ArrayList<>();
		ManagedClass.define("Outer", ns -> {
			seen.add(MDC.get(MANAGED_CLASS));
			ManagedClass.define("Inner", inner -> seen.add(MDC.get(MANAGED_CLASS)));
			seen.add(MDC.get(MANAGED_CLASS));
		});
		assertEquals(List.of("Outer", "Inner", "Outer"), seen);
		assertNull(MDC.get(MANAGED_CLASS));
	}

	@Test
	void failedNestedDefine_restoresOuterClassInMDC() {
		List<String> seen = new ArrayList<>();
		ManagedClass.define("Outer", ns -> {
			assertThrows(UsageException.class, () -> ManagedClass.define("Inner", inner -> PropertyBuilder.open(inner, "props")));
			seen.add(MDC.get(MANAGED_CLASS));
		});
		assertEquals(List.of("Outer"), seen);
		assertNull(MDC.get(MANAGED_CLASS));
	}
}
