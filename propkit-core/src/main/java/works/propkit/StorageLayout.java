package works.propkit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.pcollections.PSequence;
import works.propkit.exceptions.ConfigurationException;

import static java.util.Collections.unmodifiableList;
import static works.propkit.ClassNamespace.STORAGE_LAYOUT;
import static works.propkit.PropkitConfig.DuplicateSlotPolicy.REJECT;

/**
 * The fixed set of storage slots every instance of a {@link ManagedClass} has,
 * in declaration order.
 * <p>
 * Also home to the rule by which a {@link PropertyBuilder}'s manifest joins
 * whatever layout the {@link ClassNamespace} already declares.
 */
public final class StorageLayout {
	private final List<String> slots;
	private final Map<String, Integer> indexes;

	private StorageLayout(List<String> slots, Map<String, Integer> indexes) {
		this.slots = unmodifiableList(slots);
		this.indexes = indexes;
	}

	/**
	 * @param declared the namespace's {@link ClassNamespace#STORAGE_LAYOUT} entry; null means no slots
	 */
	static StorageLayout of(String className, Object declared, PropkitConfig config) {
		List<String> slots = new ArrayList<>();
		Map<String, Integer> indexes = new LinkedHashMap<>();
		for (String slot : slotNames(className, declared)) {
			if (indexes.containsKey(slot)) {
				if (config.duplicateSlotPolicy() == REJECT) {
					throw new ConfigurationException("Storage slot \"" + slot + "\" is declared more than once in " + className);
				}
				continue;
			}
			indexes.put(slot, slots.size());
			slots.add(slot);
		}
		return new StorageLayout(slots, indexes);
	}

	/**
	 * Adds {@code manifest} to the layout declared in {@code namespace}:
	 * <ul>
	 *     <li>if there is none, the manifest becomes the layout;</li>
	 *     <li>if it is a mutable list, the manifest is appended to it in place;</li>
	 *     <li>if it is immutable, it is replaced by the concatenation,
	 *         which is a {@link PSequence} if the original was one.</li>
	 * </ul>
	 *
	 * @throws ConfigurationException if the layout is not a list, or if it already contains
	 * one of the manifest's slots and the config {@link PropkitConfig.DuplicateSlotPolicy#REJECT rejects} duplicates
	 */
	@SuppressWarnings("unchecked")
	static void merge(ClassNamespace namespace, List<String> manifest) {
		Object existing = namespace.get(STORAGE_LAYOUT);
		if (existing == null) {
			namespace.put(STORAGE_LAYOUT, new ArrayList<>(manifest));
			return;
		}
		List<String> declared = slotNames(namespace.className(), existing);
		if (namespace.config().duplicateSlotPolicy() == REJECT) {
			for (String slot : manifest) {
				if (declared.contains(slot)) {
					throw new ConfigurationException("Storage slot \"" + slot + "\" is already declared in " + namespace.className());
				}
			}
		}

		if (existing instanceof PSequence) {
			namespace.put(STORAGE_LAYOUT, ((PSequence<String>) existing).plusAll(manifest));
			return;
		}
		List<String> existingList = (List<String>) existing;
		try {
			existingList.addAll(manifest);
		} catch (UnsupportedOperationException e) {
			List<String> concatenation = new ArrayList<>(existingList.size() + manifest.size());
			concatenation.addAll(existingList);
			concatenation.addAll(manifest);
			namespace.put(STORAGE_LAYOUT, List.copyOf(concatenation));
		}
	}

	private static List<String> slotNames(String className, Object declared) {
		if (declared == null) {
			return List.of();
		} else if (!(declared instanceof List<?> list)) {
			throw new ConfigurationException("Storage layout of " + className + " must be a List, not " + declared.getClass().getSimpleName());
		} else {
			List<String> result = new ArrayList<>(list.size());
			for (Object slot : list) {
				if (slot instanceof String s) {
					result.add(s);
				} else {
					throw new ConfigurationException("Storage layout of " + className + " contains a non-string entry: " + slot);
				}
			}
			return result;
		}
	}

	public List<String> slots() {
		return slots;
	}

	public int size() {
		return slots.size();
	}

	public boolean contains(String slot) {
		return indexes.containsKey(slot);
	}

	/**
	 * @return the position of {@code slot}, or -1 if this layout has no such slot
	 */
	public int indexOf(String slot) {
		Integer index = indexes.get(slot);
		return (index == null) ? -1 : index;
	}

	@Override
	public String toString() {
		return "StorageLayout" + slots;
	}
}
