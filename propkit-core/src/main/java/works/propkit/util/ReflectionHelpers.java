package works.propkit.util;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;

import static org.objectweb.asm.Opcodes.ASM9;

public final class ReflectionHelpers {
	private ReflectionHelpers() { }

	/**
	 * {@link Class#getDeclaredMethods()} makes no promise about order;
	 * this returns them in the order they appear in the class file,
	 * which is source order for classes compiled by javac.
	 * Constructors, static initializers, and synthetic methods are omitted.
	 *
	 * @throws IllegalArgumentException if {@code lookup} cannot access the class or one of the methods
	 */
	public static List<Method> getDeclaredMethodsInOrder(Class<?> objectClass, MethodHandles.Lookup lookup) {
		try {
			lookup.accessClass(objectClass);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Cannot access " + objectClass, e);
		}

		Map<String, Method> methodsBySignature = new HashMap<>();
		for (Method m : objectClass.getDeclaredMethods()) {
			if (!m.isSynthetic()) {
				methodsBySignature.put(m.getName() + Type.getMethodDescriptor(m), m);
			}
		}

		List<Method> result = new ArrayList<>(methodsBySignature.size());
		try (InputStream classBytes = classFileOf(objectClass)) {
			new ClassReader(classBytes).accept(new ClassVisitor(ASM9) {
				@Override
				public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
					Method method = methodsBySignature.get(name + descriptor);
					if (method != null) {
						result.add(method);
					}
					return null;
				}
			}, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
		} catch (IOException e) {
			throw new IllegalArgumentException("Unable to read class file for " + objectClass, e);
		}

		for (Method method : result) {
			try {
				lookup.unreflect(method);
			} catch (IllegalAccessException e) {
				throw new IllegalArgumentException("Cannot access " + method, e);
			}
		}
		return result;
	}

	private static InputStream classFileOf(Class<?> objectClass) throws IOException {
		String resourceName = "/" + objectClass.getName().replace('.', '/') + ".class";
		InputStream result = objectClass.getResourceAsStream(resourceName);
		if (result == null) {
			throw new IOException("No class file resource " + resourceName);
		}
		return result;
	}
}
