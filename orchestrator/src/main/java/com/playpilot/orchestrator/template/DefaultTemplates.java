package com.playpilot.orchestrator.template;

import java.util.List;

/** Templates every installation starts with. */
final class DefaultTemplates {

    record Definition(String name, String description, String body, String variablesSchema) {}

    static final Definition WEB_SERVER = new Definition(
            "Web Server Setup",
            "Basic web server installation and configuration",
            """
            ---
            - name: Setup Web Server
              hosts: {{ hosts }}
              become: yes
              vars:
                web_server: {{ web_server | default('nginx') }}
                port: {{ port | default(80) }}

              tasks:
                - name: Update apt cache
                  apt:
                    update_cache: yes
                  when: ansible_os_family == "Debian"

                - name: Install {{ web_server }}
                  apt:
                    name: "{{ web_server }}"
                    state: present
                  when: ansible_os_family == "Debian"

                - name: Start and enable {{ web_server }} service
                  systemd:
                    name: "{{ web_server }}"
                    state: started
                    enabled: yes

                - name: Configure firewall
                  ufw:
                    rule: allow
                    port: "{{ port }}"
                    proto: tcp
                  when: ansible_os_family == "Debian"
            """,
            """
            {
              "type": "object",
              "properties": {
                "hosts":      {"type": "string",  "default": "web_servers"},
                "web_server": {"type": "string",  "enum": ["nginx", "apache2"], "default": "nginx"},
                "port":       {"type": "integer", "default": 80}
              },
              "required": ["hosts"]
            }
            """);

    static final Definition DATABASE_SERVER = new Definition(
            "Database Server Setup",
            "Database server installation and basic configuration",
            """
            ---
            - name: Setup Database Server
              hosts: {{ hosts }}
              become: yes
              vars:
                db_type: {{ db_type | default('postgresql') }}
                db_port: {{ db_port | default(5432) }}

              tasks:
                - name: Update apt cache
                  apt:
                    update_cache: yes
                  when: ansible_os_family == "Debian"

                - name: Install {{ db_type }}
                  apt:
                    name: "{{ db_type }}"
                    state: present
                  when: ansible_os_family == "Debian"

                - name: Start and enable {{ db_type }} service
                  systemd:
                    name: "{{ db_type }}"
                    state: started
                    enabled: yes

                - name: Configure firewall for database
                  ufw:
                    rule: allow
                    port: "{{ db_port }}"
                    proto: tcp
                  when: ansible_os_family == "Debian"
            """,
            """
            {
              "type": "object",
              "properties": {
                "hosts":   {"type": "string",  "default": "db_servers"},
                "db_type": {"type": "string",  "enum": ["postgresql", "mysql"], "default": "postgresql"},
                "db_port": {"type": "integer", "default": 5432}
              },
              "required": ["hosts"]
            }
            """);

    static final List<Definition> ALL = List.of(WEB_SERVER, DATABASE_SERVER);

    private DefaultTemplates() {}
}
