/*
 * Copyright 2018 Davide Maestroni
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dm.pact.promise;

/**
 * Interface defining a function mapping an input into an output.
 * <p>
 * Created by davide-maestroni on 07/18/2017.
 *
 * @param <I> the input data type.
 * @param <O> the output data type.
 */
public interface Mapper<I, O> {

  /**
   * Maps the specified input.
   *
   * @param input the input.
   * @return the output.
   * @throws java.lang.Exception if an error occurred.
   */
  O apply(I input) throws Exception;
}
