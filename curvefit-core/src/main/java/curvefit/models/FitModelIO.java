/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of CurveFit
 *
 * CurveFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * CurveFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with CurveFit.  If not, see <http://www.gnu.org/licenses/>.
 */
package curvefit.models;

import curvefit.plugins.PluginFunction;
import curvefit.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads and writes fit model files (extension {@value #EXTENSION}): JSON objects holding the name, category and formula of a model,
 * its parameters with their initial values, fixed flags and ranges, and the path of the plugin for plugin models.
 * @author Jean Ollion
 */
public class FitModelIO {
    public static final Logger logger = LoggerFactory.getLogger(FitModelIO.class);
    public static final String EXTENSION = ".fit";

    /**
     * Content of a fit model file
     */
    public static class ModelDescription {
        final String name;
        final FitModel.Category category;
        final String formula;
        final List<ModelParameter> parameters;
        final Path pluginPath;

        public ModelDescription(String name, FitModel.Category category, String formula, List<ModelParameter> parameters, Path pluginPath) {
            this.name = name;
            this.category = category;
            this.formula = formula;
            this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
            this.pluginPath = pluginPath;
        }

        public String getName() {
            return name;
        }

        public FitModel.Category getCategory() {
            return category;
        }

        public String getFormula() {
            return formula;
        }

        public List<ModelParameter> getParameters() {
            return parameters;
        }

        /**
         * @return path of the plugin jar, null if this is not a plugin model
         */
        public Path getPluginPath() {
            return pluginPath;
        }

        /**
         * Applies the parameter settings of this description to {@param model}. Parameters are matched by name
         */
        public FitModel applyParameters(FitModel model) {
            FitModel res = model;
            List<String> names = model.parameterNames();
            for (ModelParameter p : parameters) {
                if (!names.contains(p.getName())) {
                    logger.warn("model {}: stored parameter {} does not exist", model.getName(), p.getName());
                    continue;
                }
                res = res.withParameter(p.getName(), current -> p);
            }
            return res;
        }
    }

    public static JSONObject toJSON(FitModel model) {
        JSONObject res = new JSONObject();
        res.put("name", model.getName());
        res.put("category", model.getCategory().name());
        if (model.getCategory()==FitModel.Category.USER_DEFINED) res.put("formula", model.getFormula());
        JSONArray params = new JSONArray();
        for (ModelParameter p : model.getParameters()) params.add(p.toJSONEntry());
        res.put("parameters", params);
        if (model.getFunction() instanceof PluginFunction) res.put("plugin", ((PluginFunction)model.getFunction()).getPath().toString());
        return res;
    }

    public static ModelDescription fromJSON(JSONObject json) {
        String name = (String)json.get("name");
        if (name==null) throw new IllegalArgumentException("Model file has no name");
        FitModel.Category category = json.containsKey("category") ? FitModel.Category.valueOf((String)json.get("category")) : FitModel.Category.USER_DEFINED;
        List<ModelParameter> parameters = new ArrayList<>();
        JSONArray params = (JSONArray)json.get("parameters");
        if (params!=null) for (Object p : params) parameters.add(ModelParameter.fromJSONEntry(p));
        Path plugin = json.containsKey("plugin") ? Paths.get((String)json.get("plugin")) : null;
        return new ModelDescription(name, category, (String)json.get("formula"), parameters, plugin);
    }

    public static void save(FitModel model, Path file) throws IOException {
        JSONUtils.write(file, toJSON(model));
        logger.debug("model {} saved to {}", model.getName(), file);
    }

    public static ModelDescription load(Path file) throws IOException {
        try {
            return fromJSON(JSONUtils.read(file));
        } catch (ParseException | ClassCastException | IllegalArgumentException e) {
            throw new IOException("Invalid fit model file: "+file, e);
        }
    }
}
