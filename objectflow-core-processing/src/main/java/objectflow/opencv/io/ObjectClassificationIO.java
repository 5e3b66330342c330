/*-
 * #%L
 * This file is part of ObjectFlow.
 * %%
 * Copyright (C) 2026 ObjectFlow developers
 * %%
 * ObjectFlow is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * ObjectFlow is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with ObjectFlow.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package objectflow.opencv.io;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import objectflow.lib.classifiers.object.ClassifierEnsemble;
import objectflow.lib.classifiers.object.ClassifierHandle;
import objectflow.lib.classifiers.object.ObjectClassifierParameters;
import objectflow.lib.classifiers.object.WarningMessage;
import objectflow.lib.classifiers.object.workflow.ObjectClassificationWorkflow;
import objectflow.lib.io.GsonTools;
import objectflow.lib.measurements.FeatureColumn;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.objects.LabelArray;
import objectflow.opencv.ml.RTreesObjectClassifier;

/**
 * Read and write the persistent state of an {@link ObjectClassificationWorkflow} as JSON: 
 * parameters, label names, selected features, the labels of each lane and the trained classifier (if any).
 * <p>
 * Images and features are not stored; lanes must be added to a workflow before labels can be restored.
 */
public class ObjectClassificationIO {
	
	private static final Logger logger = LoggerFactory.getLogger(ObjectClassificationIO.class);
	
	static final int VERSION = 1;
	
	private static Gson gson = GsonTools.getInstance().newBuilder()
			.registerTypeAdapterFactory(GsonTools.createSubTypeAdapterFactory(ClassifierHandle.class, "classifier_type")
					.registerSubtype(RTreesObjectClassifier.class, "rtrees"))
			.create();
	
	/**
	 * Get a Gson instance that can serialize classifiers.
	 * @param pretty
	 * @return
	 */
	public static Gson getGson(boolean pretty) {
		if (pretty)
			return gson.newBuilder().setPrettyPrinting().create();
		return gson;
	}
	
	/**
	 * Snapshot of the state of a workflow.
	 */
	public static class WorkflowState {
		
		private int version = VERSION;
		private Map<String, Object> parameters;
		private List<String> labelNames;
		private FeatureSelection selectedFeatures;
		private List<Map<Integer, LabelArray>> labels;
		private ClassifierState classifier;
		private WarningMessage warning;
		
		/**
		 * @return the format version
		 */
		public int getVersion() {
			return version;
		}
		
		/**
		 * Create parameters from the stored values; missing or invalid values keep their defaults.
		 * @return
		 */
		public ObjectClassifierParameters getParameters() {
			var params = new ObjectClassifierParameters();
			if (parameters != null) {
				Map<String, String> values = new LinkedHashMap<>();
				for (var entry : parameters.entrySet()) {
					var value = entry.getValue();
					// Gson reads all numbers as doubles
					if (value instanceof Number)
						values.put(entry.getKey(), Integer.toString(((Number)value).intValue()));
					else if (value != null)
						values.put(entry.getKey(), value.toString());
				}
				params.update(values, Locale.US);
			}
			return params;
		}
		
		/**
		 * @return the stored label names
		 */
		public List<String> getLabelNames() {
			return labelNames == null ? Collections.emptyList() : Collections.unmodifiableList(labelNames);
		}
		
		/**
		 * @return the stored feature selection
		 */
		public FeatureSelection getSelectedFeatures() {
			return selectedFeatures == null ? FeatureSelection.empty() : selectedFeatures;
		}
		
		/**
		 * @return the number of lanes with stored labels
		 */
		public int nLanes() {
			return labels == null ? 0 : labels.size();
		}
		
		/**
		 * @param lane
		 * @return the stored labels for a lane, by time point
		 */
		public Map<Integer, LabelArray> getLabels(int lane) {
			return Collections.unmodifiableMap(labels.get(lane));
		}
		
		/**
		 * @return the warning from the last training, or an empty message
		 */
		public WarningMessage getWarning() {
			return warning == null ? WarningMessage.empty() : warning;
		}
		
		/**
		 * @return the stored classifier, or null if none was trained
		 */
		public ClassifierEnsemble getClassifier() {
			if (classifier == null || classifier.members == null || classifier.members.isEmpty())
				return null;
			return new ClassifierEnsemble(classifier.members, classifier.columns);
		}
		
	}
	
	static class ClassifierState {
		
		private List<FeatureColumn> columns;
		private List<ClassifierHandle> members;
		
		ClassifierState(ClassifierEnsemble ensemble) {
			this.columns = new ArrayList<>(ensemble.getColumns());
			this.members = new ArrayList<>(ensemble.getMembers());
		}
		
	}
	
	/**
	 * Create a snapshot of the current state of a workflow.
	 * The classifier is only included if it is already available; it is not trained here.
	 * @param workflow
	 * @return
	 */
	public static WorkflowState createState(ObjectClassificationWorkflow workflow) {
		var state = new WorkflowState();
		state.parameters = workflow.getParameters().toMap();
		state.labelNames = new ArrayList<>(workflow.getLabelNames());
		state.selectedFeatures = workflow.getSelectedFeatures();
		state.labels = new ArrayList<>();
		for (int i = 0; i < workflow.nLanes(); i++) {
			Map<Integer, LabelArray> map = new TreeMap<>();
			for (var entry : workflow.getLane(i).getLabels().getValues(Collections.emptyList()).entrySet())
				map.put(entry.getKey(), entry.getValue().copy());
			state.labels.add(map);
		}
		state.warning = workflow.getWarnings().getValue();
		var ensemble = workflow.peekClassifier();
		if (ensemble != null)
			state.classifier = new ClassifierState(ensemble);
		return state;
	}
	
	/**
	 * Restore a snapshot into a workflow.
	 * Labels are restored for as many lanes as are available in both; the classifier is restored last, 
	 * so that it is not immediately invalidated by the restored labels.
	 * @param workflow
	 * @param state
	 */
	public static void restoreState(ObjectClassificationWorkflow workflow, WorkflowState state) {
		if (state.getVersion() > VERSION)
			logger.warn("Workflow state version {} is newer than the supported version {}", state.getVersion(), VERSION);
		workflow.setLabelNames(state.getLabelNames());
		workflow.setSelectedFeatures(state.getSelectedFeatures());
		int nLanes = Math.min(workflow.nLanes(), state.nLanes());
		if (workflow.nLanes() != state.nLanes())
			logger.warn("Workflow has {} lanes, but labels were stored for {} - only {} will be restored", 
					workflow.nLanes(), state.nLanes(), nLanes);
		for (int i = 0; i < nLanes; i++)
			workflow.getLane(i).setLabels(state.getLabels(i));
		var ensemble = state.getClassifier();
		if (ensemble != null)
			workflow.setClassifier(ensemble);
		workflow.setWarnings(state.getWarning());
	}
	
	/**
	 * Write the state of a workflow as JSON.
	 * @param workflow
	 * @param writer
	 * @throws IOException
	 */
	public static void write(ObjectClassificationWorkflow workflow, Writer writer) throws IOException {
		var state = createState(workflow);
		getGson(true).toJson(state, writer);
		writer.flush();
	}
	
	/**
	 * Read a workflow state from JSON.
	 * @param reader
	 * @return
	 * @throws IOException if the JSON cannot be parsed
	 */
	public static WorkflowState read(Reader reader) throws IOException {
		try {
			var state = gson.fromJson(reader, WorkflowState.class);
			if (state == null)
				throw new IOException("No workflow state found");
			return state;
		} catch (JsonParseException e) {
			throw new IOException("Unable to read workflow state: " + e.getLocalizedMessage(), e);
		}
	}
	
	/**
	 * Save the state of a workflow to a file.
	 * @param workflow
	 * @param path
	 * @throws IOException
	 */
	public static void save(ObjectClassificationWorkflow workflow, Path path) throws IOException {
		try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			write(workflow, writer);
		}
		logger.info("Object classification saved to {}", path);
	}
	
	/**
	 * Load a workflow state from a file and restore it into a workflow.
	 * @param workflow
	 * @param path
	 * @return the state that was read
	 * @throws IOException
	 */
	public static WorkflowState load(ObjectClassificationWorkflow workflow, Path path) throws IOException {
		WorkflowState state;
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			state = read(reader);
		}
		restoreState(workflow, state);
		logger.info("Object classification loaded from {}", path);
		return state;
	}

}
